package com.example.payreport.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Derived per-creator payment totals. Recomputed on every request and never persisted.
 * {@code paidTotal + pendingTotal} always equals the sum of the creator's accepted video amounts.
 */
public record PaymentSummary(
        Long creatorId,
        String creatorName,
        String contact,
        long videoCount,
        BigDecimal paidTotal,
        BigDecimal pendingTotal
) {

    static final int RATIO_SCALE = 4;

	/**
	 * @return paid plus pending total
	 */
    public BigDecimal totalAmount() {
        return paidTotal.add(pendingTotal);
    }

	/**
	 * Share of the total amount that has been paid, rounded half-up to four decimals.
	 *
	 * @return ratio in {@code [0, 1]}, or zero when nothing is owed at all
	 */
    public BigDecimal completionRatio() {
        BigDecimal total = totalAmount();
        if (total.signum() == 0) {
            return BigDecimal.ZERO.setScale(RATIO_SCALE);
        }
        return paidTotal.divide(total, RATIO_SCALE, RoundingMode.HALF_UP);
    }
}
