package com.example.payreport.application.exception;

/**
 * Signals that an export request cannot be satisfied with the inputs it was given.
 * Controllers translate subclasses into HTTP 422 responses with a specific error code.
 */
public abstract class UseCaseValidationException extends ApplicationException {

	/**
	 * @param message specific validation failure
	 */
    protected UseCaseValidationException(String message) {
        super(message);
    }
}
