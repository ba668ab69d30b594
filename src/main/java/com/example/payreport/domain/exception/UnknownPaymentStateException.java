package com.example.payreport.domain.exception;

/**
 * Raised when a payment state value is neither {@code pending} nor {@code paid}.
 */
public class UnknownPaymentStateException extends DomainException {

    public UnknownPaymentStateException(String rawValue) {
        super("Unknown payment status: " + (rawValue == null ? "<missing>" : "'" + rawValue + "'"));
    }
}
