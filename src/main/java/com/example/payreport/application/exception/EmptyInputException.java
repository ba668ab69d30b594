package com.example.payreport.application.exception;

/**
 * Thrown when an export is requested without a single table to serialize.
 */
public class EmptyInputException extends UseCaseValidationException {

    public EmptyInputException(String message) {
        super(message);
    }
}
