package com.example.payreport.domain.model;

/**
 * Data-integrity problems that cause a video to be left out of derived numbers.
 */
public enum SkipReason {
    UNKNOWN_CREATOR,
    INVALID_AMOUNT,
    MISSING_PAYMENT_STATE
}
