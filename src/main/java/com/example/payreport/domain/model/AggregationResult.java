package com.example.payreport.domain.model;

import java.util.List;

/**
 * Output of {@code PaymentAggregator}: summaries ordered by creator name, trend points ordered
 * chronologically, one status breakdown per {@link PaymentState}, and the diagnostics describing
 * excluded videos.
 */
public record AggregationResult(
        List<PaymentSummary> summaries,
        List<MonthlyTrendPoint> trendPoints,
        List<PaymentStatusBreakdown> statusBreakdown,
        ReportDiagnostics diagnostics
) {

    public AggregationResult {
        summaries = List.copyOf(summaries);
        trendPoints = List.copyOf(trendPoints);
        statusBreakdown = List.copyOf(statusBreakdown);
    }
}
