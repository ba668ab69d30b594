package com.example.payreport.domain.model;

import com.example.payreport.domain.exception.UnknownPaymentStateException;

import java.util.Locale;

/**
 * Payment lifecycle of a video. Amounts are either still owed or already settled.
 */
public enum PaymentState {
    PENDING,
    PAID;

	/**
	 * Parses a raw value such as {@code "paid"} or {@code " PENDING "}.
	 *
	 * @param rawValue value coming from a record source or request parameter
	 * @return matching state
	 * @throws UnknownPaymentStateException when the value does not name a state
	 */
    public static PaymentState fromString(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            throw new UnknownPaymentStateException(rawValue);
        }
        try {
            return PaymentState.valueOf(rawValue.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new UnknownPaymentStateException(rawValue);
        }
    }

	/**
	 * @return lowercase label used in exports, e.g. {@code paid}
	 */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
