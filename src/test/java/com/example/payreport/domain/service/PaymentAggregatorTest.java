package com.example.payreport.domain.service;

import com.example.payreport.domain.model.AggregationResult;
import com.example.payreport.domain.model.Creator;
import com.example.payreport.domain.model.MonthlyTrendPoint;
import com.example.payreport.domain.model.PaymentState;
import com.example.payreport.domain.model.PaymentStatusBreakdown;
import com.example.payreport.domain.model.PaymentSummary;
import com.example.payreport.domain.model.SkipReason;
import com.example.payreport.domain.model.SkippedRecord;
import com.example.payreport.domain.model.Video;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

import static com.example.payreport.support.TestRecords.creator;
import static com.example.payreport.support.TestRecords.video;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the payment aggregation rules.
 */
class PaymentAggregatorTest {

    private final PaymentAggregator aggregator = new PaymentAggregator();

    /**
     * Two creators, one with a paid and a pending video, one without videos, zero-video creators enabled.
     */
    @Test
    void aggregateIncludesZeroVideoCreatorsWhenRequested() {
        List<Creator> creators = List.of(creator(1, "A"), creator(2, "B"));
        List<Video> videos = List.of(
                video(10, 1L, "2024-01-10", PaymentState.PAID, "100.00"),
                video(11, 1L, "2024-01-20", PaymentState.PENDING, "50.00"));

        AggregationResult result = aggregator.aggregate(videos, creators, true);

        assertThat(result.summaries()).containsExactly(
                new PaymentSummary(1L, "A", "a@example.com", 2, new BigDecimal("100.00"), new BigDecimal("50.00")),
                new PaymentSummary(2L, "B", "b@example.com", 0, new BigDecimal("0.00"), new BigDecimal("0.00")));
    }

    @Test
    void aggregateOmitsZeroVideoCreatorsByDefault() {
        List<Creator> creators = List.of(creator(1, "A"), creator(2, "B"));
        List<Video> videos = List.of(video(10, 1L, "2024-01-10", PaymentState.PAID, "100.00"));

        AggregationResult result = aggregator.aggregate(videos, creators, false);

        assertThat(result.summaries()).extracting(PaymentSummary::creatorName).containsExactly("A");
    }

    @Test
    void aggregateOfEmptyVideoSetIsEmpty() {
        AggregationResult result = aggregator.aggregate(List.of(), List.of(creator(1, "A")), false);

        assertThat(result.summaries()).isEmpty();
        assertThat(result.trendPoints()).isEmpty();
        assertThat(result.diagnostics().skippedCount()).isZero();
    }

    /**
     * A video pointing at an unknown creator is excluded everywhere and counted exactly once.
     */
    @Test
    void unknownCreatorIsSkippedAndCountedOnce() {
        List<Video> videos = List.of(
                video(10, 1L, "2024-01-10", PaymentState.PAID, "100.00"),
                video(11, 99L, "2024-01-15", PaymentState.PENDING, "70.00"));

        AggregationResult result = aggregator.aggregate(videos, List.of(creator(1, "A")), false);

        assertThat(result.diagnostics().skippedCount()).isEqualTo(1);
        assertThat(result.diagnostics().skippedRecords().get(0).videoId()).isEqualTo(11L);
        assertThat(result.diagnostics().skippedRecords().get(0).reason()).isEqualTo(SkipReason.UNKNOWN_CREATOR);
        assertThat(result.summaries()).hasSize(1);
        assertThat(result.summaries().get(0).pendingTotal()).isEqualByComparingTo("0");
        assertThat(result.trendPoints()).hasSize(1);
        assertThat(result.trendPoints().get(0).videoCount()).isEqualTo(1);
    }

    @Test
    void invalidAmountAndMissingStateAreSkipped() {
        List<Video> videos = List.of(
                video(10, 1L, "2024-01-10", PaymentState.PAID, "-5.00"),
                video(11, 1L, "2024-01-10", PaymentState.PAID, null),
                video(12, 1L, "2024-01-10", null, "20.00"),
                video(13, 1L, "2024-01-10", PaymentState.PAID, "20.00"));

        AggregationResult result = aggregator.aggregate(videos, List.of(creator(1, "A")), false);

        assertThat(result.diagnostics().skippedRecords())
                .extracting(SkippedRecord::reason)
                .containsExactly(SkipReason.INVALID_AMOUNT, SkipReason.INVALID_AMOUNT, SkipReason.MISSING_PAYMENT_STATE);
        assertThat(result.summaries().get(0).videoCount()).isEqualTo(1);
        assertThat(result.summaries().get(0).paidTotal()).isEqualTo(new BigDecimal("20.00"));
    }

    /**
     * Paid plus pending must equal the amount sum for each creator, without floating point drift.
     */
    @Test
    void totalsMatchAmountSumPerCreator() {
        List<Creator> creators = List.of(creator(1, "A"), creator(2, "B"));
        List<Video> videos = new ArrayList<>();
        BigDecimal expectedA = BigDecimal.ZERO;
        for (int i = 0; i < 30; i++) {
            String amount = "0." + String.format("%02d", 10 + i);
            videos.add(video(100 + i, 1L, "2024-02-01", i % 3 == 0 ? PaymentState.PAID : PaymentState.PENDING, amount));
            expectedA = expectedA.add(new BigDecimal(amount));
        }
        videos.add(video(200, 2L, null, PaymentState.PAID, "19.99"));

        AggregationResult result = aggregator.aggregate(videos, creators, false);

        PaymentSummary a = result.summaries().get(0);
        PaymentSummary b = result.summaries().get(1);
        assertThat(a.paidTotal().add(a.pendingTotal())).isEqualByComparingTo(expectedA);
        assertThat(a.totalAmount()).isEqualByComparingTo(expectedA);
        assertThat(b.totalAmount()).isEqualByComparingTo("19.99");
        assertThat(a.paidTotal().signum()).isPositive();
        assertThat(b.pendingTotal().signum()).isZero();
    }

    /**
     * Buckets are chronological, unique, not gap-filled, and ignore undated videos.
     */
    @Test
    void trendPointsAreChronologicalWithoutGapsFilled() {
        List<Video> videos = List.of(
                video(1, 1L, "2024-03-05", PaymentState.PENDING, "30.00"),
                video(2, 1L, "2023-12-31", PaymentState.PAID, "10.00"),
                video(3, 1L, "2024-03-28", PaymentState.PAID, "5.50"),
                video(4, 1L, null, PaymentState.PAID, "1000.00"),
                video(5, 1L, "2024-01-01", PaymentState.PENDING, "2.25"));

        AggregationResult result = aggregator.aggregate(videos, List.of(creator(1, "A")), false);

        assertThat(result.trendPoints()).extracting(MonthlyTrendPoint::bucket)
                .containsExactly(YearMonth.of(2023, 12), YearMonth.of(2024, 1), YearMonth.of(2024, 3))
                .doesNotHaveDuplicates();
        MonthlyTrendPoint march = result.trendPoints().get(2);
        assertThat(march.videoCount()).isEqualTo(2);
        assertThat(march.paidTotal()).isEqualTo(new BigDecimal("5.50"));
        assertThat(march.pendingTotal()).isEqualTo(new BigDecimal("30.00"));
        assertThat(result.summaries().get(0).videoCount()).isEqualTo(5);
    }

    @Test
    void summariesAreOrderedByCreatorName() {
        List<Creator> creators = List.of(creator(1, "zeta"), creator(2, "Alpha"), creator(3, "beta"));
        List<Video> videos = List.of(
                video(1, 1L, null, PaymentState.PAID, "1.00"),
                video(2, 2L, null, PaymentState.PAID, "1.00"),
                video(3, 3L, null, PaymentState.PAID, "1.00"));

        AggregationResult result = aggregator.aggregate(videos, creators, false);

        assertThat(result.summaries()).extracting(PaymentSummary::creatorName).containsExactly("Alpha", "beta", "zeta");
    }

    @Test
    void statusBreakdownCoversEveryState() {
        List<Video> videos = List.of(
                video(1, 1L, null, PaymentState.PAID, "10.00"),
                video(2, 1L, null, PaymentState.PAID, "15.00"));

        AggregationResult result = aggregator.aggregate(videos, List.of(creator(1, "A")), false);

        assertThat(result.statusBreakdown()).containsExactly(
                new PaymentStatusBreakdown(PaymentState.PENDING, 0, new BigDecimal("0.00")),
                new PaymentStatusBreakdown(PaymentState.PAID, 2, new BigDecimal("25.00")));
    }

    @Test
    void identicalInputYieldsIdenticalOutput() {
        List<Creator> creators = List.of(creator(1, "A"), creator(2, "B"));
        List<Video> videos = List.of(
                video(1, 2L, "2024-02-01", PaymentState.PAID, "10.00"),
                video(2, 1L, "2024-01-01", PaymentState.PENDING, "20.00"),
                video(3, 7L, "2024-01-01", PaymentState.PENDING, "20.00"));

        assertThat(aggregator.aggregate(videos, creators, true))
                .isEqualTo(aggregator.aggregate(videos, creators, true));
    }

    @Test
    void duplicateCreatorIdentifiersKeepFirstEntry() {
        List<Creator> creators = List.of(creator(1, "First"), creator(1, "Second"));
        List<Video> videos = List.of(video(1, 1L, null, PaymentState.PAID, "10.00"));

        AggregationResult result = aggregator.aggregate(videos, creators, false);

        assertThat(result.summaries()).extracting(PaymentSummary::creatorName).containsExactly("First");
    }
}
