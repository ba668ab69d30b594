package com.example.payreport.domain.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Headline numbers for the dashboard, derived from the same aggregation as the reports.
 */
public record DashboardStats(
        long totalCreators,
        long totalVideos,
        BigDecimal totalPaid,
        BigDecimal totalPending,
        List<PaymentStatusBreakdown> paymentDistribution,
        List<MonthlyTrendPoint> recentTrend,
        List<RecentVideo> recentVideos,
        ReportDiagnostics diagnostics
) {

    public BigDecimal totalAmount() {
        return totalPaid.add(totalPending);
    }
}
