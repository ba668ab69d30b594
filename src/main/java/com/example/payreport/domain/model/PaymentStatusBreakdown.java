package com.example.payreport.domain.model;

import java.math.BigDecimal;

/**
 * Number of videos and their amount total for one payment state.
 */
public record PaymentStatusBreakdown(PaymentState state, long videoCount, BigDecimal total) {
}
