package com.example.payreport.domain.service;

import com.example.payreport.domain.model.Creator;
import com.example.payreport.domain.model.PaymentSummary;
import com.example.payreport.domain.model.ReportColumn;
import com.example.payreport.domain.model.ReportDataset;
import com.example.payreport.domain.model.ReportKind;
import com.example.payreport.domain.model.ReportTable;
import com.example.payreport.domain.model.Video;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Turns a {@link ReportDataset} into fixed-schema {@link ReportTable}s, one per entity kind.
 * Pure transform: the dataset is never modified and every call allocates fresh tables.
 */
public class ReportTableBuilder {

    static final List<ReportColumn> CREATOR_COLUMNS = List.of(
            ReportColumn.text("Name"),
            ReportColumn.text("Channel Link"),
            ReportColumn.text("Category"),
            ReportColumn.text("Contact"),
            ReportColumn.text("Notes"),
            ReportColumn.date("Created Date")
    );
    static final List<ReportColumn> VIDEO_COLUMNS = List.of(
            ReportColumn.text("Title"),
            ReportColumn.text("Creator"),
            ReportColumn.date("Upload Date"),
            ReportColumn.text("Payment Status"),
            ReportColumn.decimal("Amount"),
            ReportColumn.text("Link"),
            ReportColumn.text("Description")
    );
    static final List<ReportColumn> PAYMENT_COLUMNS = List.of(
            ReportColumn.text("Creator"),
            ReportColumn.text("Contact"),
            ReportColumn.integer("Videos"),
            ReportColumn.decimal("Paid Total"),
            ReportColumn.decimal("Pending Total"),
            ReportColumn.decimal("Completion Ratio")
    );

    private static final Comparator<Creator> CREATOR_ORDER = Comparator
            .comparing(Creator::name, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
            .thenComparing(Creator::name, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Creator::id, Comparator.nullsLast(Comparator.naturalOrder()));

    private static final Comparator<Video> NEWEST_UPLOAD_FIRST = Comparator
            .comparing(Video::uploadDate, Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()));

	/**
	 * Builds the tables for a report kind.
	 *
	 * @param kind    requested kind; {@link ReportKind#COMBINED} yields creators, videos and payments
	 * @param dataset records and aggregation to render
	 * @return one table per component kind, never empty
	 */
    public List<ReportTable> build(ReportKind kind, ReportDataset dataset) {
        List<ReportTable> tables = new ArrayList<>();
        for (ReportKind component : kind.components()) {
            tables.add(switch (component) {
                case CREATORS -> creatorsTable(dataset.creators());
                case VIDEOS -> videosTable(dataset.videos(), PaymentAggregator.indexById(dataset.creators()));
                case PAYMENTS -> paymentsTable(dataset.aggregation().summaries());
                case COMBINED -> throw new IllegalStateException("combined is not a component kind");
            });
        }
        return tables;
    }

	/**
	 * Duplicate identifiers collapse to the first creator, as in every other lookup.
	 */
    ReportTable creatorsTable(List<Creator> creators) {
        Collection<Creator> distinct = PaymentAggregator.indexById(creators).values();
        List<List<Object>> rows = new ArrayList<>(distinct.size());
        distinct.stream().sorted(CREATOR_ORDER).forEach(creator -> rows.add(row(
                creator.name(),
                creator.channelLink(),
                creator.category(),
                creator.contact(),
                creator.notes(),
                creator.createdAt() == null ? null : creator.createdAt().toLocalDate()
        )));
        return new ReportTable(ReportKind.CREATORS, CREATOR_COLUMNS, rows);
    }

	/**
	 * Videos whose creator cannot be resolved are left out; the aggregator already counts them.
	 */
    ReportTable videosTable(List<Video> videos, Map<Long, Creator> creatorsById) {
        List<Video> ordered = new ArrayList<>(videos);
        ordered.sort(NEWEST_UPLOAD_FIRST);
        List<List<Object>> rows = new ArrayList<>(ordered.size());
        for (Video video : ordered) {
            Creator creator = video.creatorId() == null ? null : creatorsById.get(video.creatorId());
            if (creator == null) {
                continue;
            }
            rows.add(row(
                    video.title(),
                    creator.name(),
                    video.uploadDate(),
                    video.paymentState() == null ? null : video.paymentState().label(),
                    PaymentAggregator.normalizeAmount(video.amount()),
                    video.link(),
                    video.description()
            ));
        }
        return new ReportTable(ReportKind.VIDEOS, VIDEO_COLUMNS, rows);
    }

    ReportTable paymentsTable(List<PaymentSummary> summaries) {
        List<List<Object>> rows = new ArrayList<>(summaries.size());
        summaries.stream().sorted(PaymentAggregator.BY_CREATOR_NAME).forEach(summary -> rows.add(row(
                summary.creatorName(),
                summary.contact(),
                summary.videoCount(),
                summary.paidTotal(),
                summary.pendingTotal(),
                summary.completionRatio()
        )));
        return new ReportTable(ReportKind.PAYMENTS, PAYMENT_COLUMNS, rows);
    }

    private static List<Object> row(Object... cells) {
        return Arrays.asList(cells);
    }
}
