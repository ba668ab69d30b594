package com.example.payreport.domain.exception;

/**
 * Raised when a caller asks for an export format that is neither a flat table nor a workbook.
 */
public class UnsupportedExportFormatException extends DomainException {

	/**
	 * @param rawValue value supplied by the caller
	 */
    public UnsupportedExportFormatException(String rawValue) {
        super("Unsupported export format: " + (rawValue == null ? "<missing>" : "'" + rawValue + "'")
                + ". Expected csv or xlsx.");
    }
}
