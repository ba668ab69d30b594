package com.example.payreport.infrastructure.exception;

/**
 * Signals that the creator and video snapshot could not be read.
 */
public class RecordSourceException extends InfrastructureException {

	/**
	 * @param message description shared with the application layer
	 * @param cause   low-level I/O or parsing exception
	 */
    public RecordSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
