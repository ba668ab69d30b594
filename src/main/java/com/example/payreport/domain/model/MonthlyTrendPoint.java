package com.example.payreport.domain.model;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * Derived totals for every video uploaded within one calendar month.
 */
public record MonthlyTrendPoint(
        YearMonth bucket,
        long videoCount,
        BigDecimal paidTotal,
        BigDecimal pendingTotal
) {

    public BigDecimal totalAmount() {
        return paidTotal.add(pendingTotal);
    }
}
