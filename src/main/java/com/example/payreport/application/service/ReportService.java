package com.example.payreport.application.service;

import com.example.payreport.domain.model.AggregationResult;
import com.example.payreport.domain.model.Creator;
import com.example.payreport.domain.model.ExportFormat;
import com.example.payreport.domain.model.ExportedReport;
import com.example.payreport.domain.model.ReportDataset;
import com.example.payreport.domain.model.ReportKind;
import com.example.payreport.domain.model.ReportTable;
import com.example.payreport.domain.model.SkippedRecord;
import com.example.payreport.domain.model.Video;
import com.example.payreport.domain.model.VideoFilter;
import com.example.payreport.domain.port.RecordSource;
import com.example.payreport.domain.service.PaymentAggregator;
import com.example.payreport.domain.service.ReportTableBuilder;
import com.example.payreport.infrastructure.config.ReportProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Application-layer service that runs the reporting pipeline:
 * record source snapshot, aggregation, table building and export.
 * Holds no state between calls.
 */
@Service
public class ReportService {

    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    private final RecordSource recordSource;
    private final PaymentAggregator aggregator;
    private final ReportTableBuilder tableBuilder;
    private final ReportExporter exporter;
    private final ReportProperties properties;

	/**
	 * Creates the service with its collaborators.
	 *
	 * @param recordSource read-only creator and video snapshots
	 * @param aggregator   pure payment aggregation
	 * @param tableBuilder pure table assembly
	 * @param exporter     format dispatch and file naming
	 * @param properties   reporting configuration
	 */
    public ReportService(RecordSource recordSource,
                         PaymentAggregator aggregator,
                         ReportTableBuilder tableBuilder,
                         ReportExporter exporter,
                         ReportProperties properties) {
        this.recordSource = recordSource;
        this.aggregator = aggregator;
        this.tableBuilder = tableBuilder;
        this.exporter = exporter;
        this.properties = properties;
    }

	/**
	 * Builds and serializes a report over every record.
	 *
	 * @param kind   report kind
	 * @param format output format
	 * @return payload, file name and diagnostics
	 */
    public ExportedReport buildReport(ReportKind kind, ExportFormat format) {
        return buildReport(kind, format, VideoFilter.none());
    }

	/**
	 * Builds and serializes a report over the videos matching {@code filter}.
	 *
	 * @param kind   report kind
	 * @param format output format
	 * @param filter optional video restriction
	 * @return payload, file name and diagnostics
	 */
    public ExportedReport buildReport(ReportKind kind, ExportFormat format, VideoFilter filter) {
        log.info("Building {} report as {}", kind.label(), format.fileExtension());
        ReportDataset dataset = loadDataset(filter, properties.aggregation().includeZeroVideoCreators());
        List<ReportTable> tables = tableBuilder.build(kind, dataset);
        ExportedReport report = exporter.export(kind, tables, format, dataset.aggregation().diagnostics());
        log.info("Exported {} ({} bytes, {} skipped records)",
                report.fileName(), report.content().length, report.diagnostics().skippedCount());
        return report;
    }

	/**
	 * Derives summaries and trend points without exporting anything.
	 *
	 * @param filter optional video restriction
	 * @return aggregation over the current snapshot
	 */
    public AggregationResult aggregate(VideoFilter filter) {
        return loadDataset(filter, properties.aggregation().includeZeroVideoCreators()).aggregation();
    }

    ReportDataset loadDataset(VideoFilter filter, boolean includeZeroVideoCreators) {
        List<Creator> creators = recordSource.listCreators();
        List<Video> videos = recordSource.listVideos(filter == null ? VideoFilter.none() : filter);
        AggregationResult aggregation = aggregator.aggregate(videos, creators, includeZeroVideoCreators);
        for (SkippedRecord skipped : aggregation.diagnostics().skippedRecords()) {
            log.warn("Skipped video {} (creator {}): {}", skipped.videoId(), skipped.creatorId(), skipped.reason());
        }
        return new ReportDataset(creators, videos, aggregation);
    }
}
