package com.example.payreport.domain.exception;

/**
 * Raised when a caller asks for a report kind outside creators, videos, payments and combined.
 */
public class UnsupportedReportKindException extends DomainException {

	/**
	 * @param rawValue value supplied by the caller
	 */
    public UnsupportedReportKindException(String rawValue) {
        super("Unsupported report type: " + (rawValue == null ? "<missing>" : "'" + rawValue + "'")
                + ". Expected one of creators, videos, payments, combined.");
    }
}
