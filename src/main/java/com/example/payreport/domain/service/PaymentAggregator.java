package com.example.payreport.domain.service;

import com.example.payreport.domain.model.AggregationResult;
import com.example.payreport.domain.model.Creator;
import com.example.payreport.domain.model.MonthlyTrendPoint;
import com.example.payreport.domain.model.PaymentState;
import com.example.payreport.domain.model.PaymentStatusBreakdown;
import com.example.payreport.domain.model.PaymentSummary;
import com.example.payreport.domain.model.ReportDiagnostics;
import com.example.payreport.domain.model.SkipReason;
import com.example.payreport.domain.model.SkippedRecord;
import com.example.payreport.domain.model.Video;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives per-creator payment summaries and per-month trend points from raw records.
 * <p>
 * Stateless and free of clocks or randomness: the same input always yields the same output, and
 * instances can be shared between threads. All sums use {@link BigDecimal} at scale 2.
 */
public class PaymentAggregator {

    public static final int AMOUNT_SCALE = 2;

    /**
     * Presentation order of summaries: creator name ascending (case-insensitive), then id.
     */
    public static final Comparator<PaymentSummary> BY_CREATOR_NAME = Comparator
            .comparing(PaymentSummary::creatorName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
            .thenComparing(PaymentSummary::creatorName, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(PaymentSummary::creatorId, Comparator.nullsLast(Comparator.naturalOrder()));

	/**
	 * Aggregates the videos against a creator collection.
	 *
	 * @param videos                   videos in source order
	 * @param creators                 creators the videos refer to; duplicates keep the first entry
	 * @param includeZeroVideoCreators whether creators without accepted videos get a zero summary
	 * @return summaries, trend points and diagnostics
	 */
    public AggregationResult aggregate(List<Video> videos,
                                       Collection<Creator> creators,
                                       boolean includeZeroVideoCreators) {
        return aggregate(videos, indexById(creators), includeZeroVideoCreators);
    }

	/**
	 * Aggregates the videos against a creator lookup.
	 * Videos with an unknown creator, a missing or negative amount, or no payment state are excluded
	 * and reported once each in the returned diagnostics.
	 *
	 * @param videos                   videos in source order
	 * @param creatorsById             lookup from creator identifier to creator
	 * @param includeZeroVideoCreators whether creators without accepted videos get a zero summary
	 * @return summaries ordered by creator name, trend points ordered chronologically, diagnostics
	 */
    public AggregationResult aggregate(List<Video> videos,
                                       Map<Long, Creator> creatorsById,
                                       boolean includeZeroVideoCreators) {
        Map<Long, Totals> perCreator = new LinkedHashMap<>();
        TreeMap<YearMonth, Totals> perMonth = new TreeMap<>();
        EnumMap<PaymentState, Totals> perState = new EnumMap<>(PaymentState.class);
        List<SkippedRecord> skipped = new ArrayList<>();

        for (Video video : videos) {
            SkipReason problem = validate(video, creatorsById);
            if (problem != null) {
                skipped.add(new SkippedRecord(video.id(), video.creatorId(), problem));
                continue;
            }
            BigDecimal amount = normalizeAmount(video.amount());
            perCreator.computeIfAbsent(video.creatorId(), id -> new Totals()).add(video.paymentState(), amount);
            perState.computeIfAbsent(video.paymentState(), state -> new Totals()).add(video.paymentState(), amount);
            if (video.uploadDate() != null) {
                perMonth.computeIfAbsent(YearMonth.from(video.uploadDate()), month -> new Totals())
                        .add(video.paymentState(), amount);
            }
        }

        if (includeZeroVideoCreators) {
            for (Long creatorId : creatorsById.keySet()) {
                perCreator.putIfAbsent(creatorId, new Totals());
            }
        }

        List<PaymentSummary> summaries = new ArrayList<>(perCreator.size());
        perCreator.forEach((creatorId, totals) -> {
            Creator creator = creatorsById.get(creatorId);
            summaries.add(new PaymentSummary(creatorId, creator.name(), creator.contact(),
                    totals.count, totals.paid, totals.pending));
        });
        summaries.sort(BY_CREATOR_NAME);

        List<MonthlyTrendPoint> trend = new ArrayList<>(perMonth.size());
        perMonth.forEach((month, totals) ->
                trend.add(new MonthlyTrendPoint(month, totals.count, totals.paid, totals.pending)));

        List<PaymentStatusBreakdown> breakdown = new ArrayList<>();
        for (PaymentState state : PaymentState.values()) {
            Totals totals = perState.getOrDefault(state, new Totals());
            breakdown.add(new PaymentStatusBreakdown(state, totals.count, totals.paid.add(totals.pending)));
        }

        return new AggregationResult(summaries, trend, breakdown, new ReportDiagnostics(skipped));
    }

	/**
	 * Builds an insertion-ordered lookup, keeping the first creator seen for each identifier.
	 *
	 * @param creators creators in source order
	 * @return lookup keyed by creator identifier
	 */
    public static Map<Long, Creator> indexById(Collection<Creator> creators) {
        Map<Long, Creator> index = new LinkedHashMap<>();
        for (Creator creator : creators) {
            if (creator != null && creator.id() != null) {
                index.putIfAbsent(creator.id(), creator);
            }
        }
        return index;
    }

    private SkipReason validate(Video video, Map<Long, Creator> creatorsById) {
        if (video.creatorId() == null || !creatorsById.containsKey(video.creatorId())) {
            return SkipReason.UNKNOWN_CREATOR;
        }
        if (video.amount() == null || video.amount().signum() < 0) {
            return SkipReason.INVALID_AMOUNT;
        }
        if (video.paymentState() == null) {
            return SkipReason.MISSING_PAYMENT_STATE;
        }
        return null;
    }

	/**
	 * Rounds a monetary amount to {@link #AMOUNT_SCALE} fractional digits, half up.
	 *
	 * @param amount amount as recorded, may be {@code null}
	 * @return rounded amount, or {@code null} when none was recorded
	 */
    public static BigDecimal normalizeAmount(BigDecimal amount) {
        return amount == null ? null : amount.setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
    }

    private static final class Totals {
        private long count;
        private BigDecimal paid = BigDecimal.ZERO.setScale(AMOUNT_SCALE);
        private BigDecimal pending = BigDecimal.ZERO.setScale(AMOUNT_SCALE);

        void add(PaymentState state, BigDecimal amount) {
            count++;
            if (state == PaymentState.PAID) {
                paid = paid.add(amount);
            } else {
                pending = pending.add(amount);
            }
        }
    }
}
