package com.example.payreport.application.service;

import com.example.payreport.domain.model.AggregationResult;
import com.example.payreport.domain.model.Creator;
import com.example.payreport.domain.model.DashboardStats;
import com.example.payreport.domain.model.MonthlyTrendPoint;
import com.example.payreport.domain.model.PaymentSummary;
import com.example.payreport.domain.model.RecentVideo;
import com.example.payreport.domain.model.ReportDataset;
import com.example.payreport.domain.model.Video;
import com.example.payreport.domain.model.VideoFilter;
import com.example.payreport.domain.service.PaymentAggregator;
import com.example.payreport.infrastructure.config.ReportProperties;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Application-layer service feeding the dashboard and the payments overview page.
 * Reuses the reporting aggregation so both screens agree with the exports.
 */
@Service
public class DashboardService {

    static final int PAYMENTS_PAGE_TREND_MONTHS = 12;

    /**
     * Follow-up order: largest outstanding amount first.
     */
    static final Comparator<PaymentSummary> OUTSTANDING_FIRST = Comparator
            .comparing(PaymentSummary::pendingTotal, Comparator.reverseOrder())
            .thenComparing(PaymentSummary::paidTotal, Comparator.reverseOrder())
            .thenComparing(PaymentAggregator.BY_CREATOR_NAME);

    private static final Comparator<Video> NEWEST_RECORDED_FIRST = Comparator
            .comparing(Video::createdAt, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()));

    private final ReportService reportService;
    private final ReportProperties properties;

    public DashboardService(ReportService reportService, ReportProperties properties) {
        this.reportService = reportService;
        this.properties = properties;
    }

	/**
	 * Computes the dashboard headline numbers and the recent monthly trend.
	 *
	 * @return totals over every record plus the configured number of most recent trend points and videos
	 */
    public DashboardStats stats() {
        ReportDataset dataset = reportService.loadDataset(VideoFilter.none(), false);
        AggregationResult aggregation = dataset.aggregation();

        long totalVideos = 0;
        BigDecimal paid = BigDecimal.ZERO.setScale(PaymentAggregator.AMOUNT_SCALE);
        BigDecimal pending = BigDecimal.ZERO.setScale(PaymentAggregator.AMOUNT_SCALE);
        for (PaymentSummary summary : aggregation.summaries()) {
            totalVideos += summary.videoCount();
            paid = paid.add(summary.paidTotal());
            pending = pending.add(summary.pendingTotal());
        }
        Map<Long, Creator> creatorsById = PaymentAggregator.indexById(dataset.creators());

        return new DashboardStats(
                creatorsById.size(),
                totalVideos,
                paid,
                pending,
                aggregation.statusBreakdown(),
                mostRecent(aggregation.trendPoints(), properties.dashboard().trendMonths()),
                recentVideos(dataset.videos(), creatorsById, properties.dashboard().recentVideos()),
                aggregation.diagnostics()
        );
    }

	/**
	 * Builds the payments overview: creators with at least one video, largest pending total first,
	 * and the last twelve trend points in chronological order.
	 *
	 * @return overview model for the payments page
	 */
    public PaymentsOverview paymentsOverview() {
        AggregationResult aggregation = reportService.loadDataset(VideoFilter.none(), false).aggregation();
        List<PaymentSummary> ordered = aggregation.summaries().stream()
                .sorted(OUTSTANDING_FIRST)
                .toList();
        return new PaymentsOverview(ordered,
                mostRecent(aggregation.trendPoints(), PAYMENTS_PAGE_TREND_MONTHS),
                aggregation.diagnostics().skippedCount());
    }

	/**
	 * Newest recorded videos first; videos without a resolvable creator are not listed.
	 */
    static List<RecentVideo> recentVideos(List<Video> videos, Map<Long, Creator> creatorsById, int limit) {
        return videos.stream()
                .filter(video -> video.creatorId() != null && creatorsById.containsKey(video.creatorId()))
                .sorted(NEWEST_RECORDED_FIRST)
                .limit(Math.max(limit, 0))
                .map(video -> new RecentVideo(
                        video.title(),
                        creatorsById.get(video.creatorId()).name(),
                        PaymentAggregator.normalizeAmount(video.amount()),
                        video.paymentState()))
                .toList();
    }

    static List<MonthlyTrendPoint> mostRecent(List<MonthlyTrendPoint> chronological, int months) {
        if (months <= 0 || chronological.size() <= months) {
            return chronological;
        }
        return List.copyOf(chronological.subList(chronological.size() - months, chronological.size()));
    }

	/**
	 * View model of the payments page.
	 *
	 * @param summaries      summaries in follow-up order
	 * @param trendPoints    recent months, oldest first
	 * @param skippedRecords number of videos excluded from the numbers
	 */
    public record PaymentsOverview(List<PaymentSummary> summaries,
                                   List<MonthlyTrendPoint> trendPoints,
                                   int skippedRecords) {
    }
}
