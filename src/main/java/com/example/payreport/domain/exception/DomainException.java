package com.example.payreport.domain.exception;

/**
 * Base type for all domain-level exceptions in the core model.
 * Subclasses capture invalid domain input without leaking infrastructure dependencies.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * Creates a domain exception with a descriptive failure message.
	 *
	 * @param message explanation of which rule was broken
	 */
    protected DomainException(String message) {
        super(message);
    }
}
