package com.example.payreport.domain.model;

import java.math.BigDecimal;

/**
 * Dashboard entry for one recently recorded video, with its creator's name resolved.
 *
 * @param title        video title
 * @param creatorName  owning creator's display name
 * @param amount       amount at two fractional digits, {@code null} when none was recorded
 * @param paymentState payment state, {@code null} when unreadable
 */
public record RecentVideo(
        String title,
        String creatorName,
        BigDecimal amount,
        PaymentState paymentState
) {
}
