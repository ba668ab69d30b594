package com.example.payreport.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Domain DTO describing a single video and the payment owed for it.
 * {@code creatorId} must resolve to a known {@link Creator}; the aggregator reports it otherwise.
 */
public record Video(
        Long id,
        Long creatorId,
        String title,
        LocalDate uploadDate,
        PaymentState paymentState,
        BigDecimal amount,
        String link,
        String description,
        LocalDateTime createdAt
) {
}
