package com.example.payreport.application.exception;

/**
 * Base unchecked exception for failures in the application layer.
 * Report use cases throw subclasses of this type to abort a single export request without
 * coupling to the transport or persistence infrastructure.
 */
public abstract class ApplicationException extends RuntimeException {

	/**
	 * Creates a new application-layer exception with the provided message.
	 *
	 * @param message human readable error description suitable for surfacing to the caller
	 */
    protected ApplicationException(String message) {
        super(message);
    }
}
