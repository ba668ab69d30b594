package com.example.payreport.infrastructure.exception;

/**
 * Infrastructure-layer exception raised when a writer library fails to produce its output stream.
 */
public class ReportRenderingException extends InfrastructureException {

    public ReportRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
