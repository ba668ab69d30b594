package com.example.payreport.application.service;

import com.example.payreport.application.exception.FormatMismatchException;
import com.example.payreport.domain.model.AggregationResult;
import com.example.payreport.domain.model.ExportFormat;
import com.example.payreport.domain.model.ExportedReport;
import com.example.payreport.domain.model.PaymentState;
import com.example.payreport.domain.model.ReportKind;
import com.example.payreport.domain.model.VideoFilter;
import com.example.payreport.domain.port.RecordSource;
import com.example.payreport.domain.service.PaymentAggregator;
import com.example.payreport.domain.service.ReportTableBuilder;
import com.example.payreport.infrastructure.config.ReportProperties;
import com.example.payreport.infrastructure.export.CsvReportWriter;
import com.example.payreport.infrastructure.export.XlsxReportWriter;
import com.example.payreport.support.TestRecords;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.example.payreport.support.TestRecords.creator;
import static com.example.payreport.support.TestRecords.video;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Tests the reporting pipeline end to end against a mocked record source.
 */
@ExtendWith(MockitoExtension.class)
class ReportServiceTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC);

    @Mock
    private RecordSource recordSource;

    @Test
    void emptyCreatorsReportContainsOnlyHeader() {
        given(recordSource.listCreators()).willReturn(List.of());
        given(recordSource.listVideos(any())).willReturn(List.of());

        ExportedReport report = service(false).buildReport(ReportKind.CREATORS, ExportFormat.FLAT_TABLE);

        assertThat(new String(report.content(), StandardCharsets.UTF_8))
                .isEqualTo("Name,Channel Link,Category,Contact,Notes,Created Date\n");
        assertThat(report.fileName()).isEqualTo("creators_export_20240301.csv");
    }

    @Test
    void combinedReportAsFlatTableFails() {
        given(recordSource.listCreators()).willReturn(List.of(creator(1, "A")));
        given(recordSource.listVideos(any())).willReturn(List.of());

        assertThrows(FormatMismatchException.class,
                () -> service(false).buildReport(ReportKind.COMBINED, ExportFormat.FLAT_TABLE));
    }

    /**
     * Videos with unknown creators are left out of the payload and reported in the diagnostics.
     */
    @Test
    void paymentsReportCarriesSkippedRecordDiagnostics() {
        given(recordSource.listCreators()).willReturn(List.of(creator(1, "A")));
        given(recordSource.listVideos(VideoFilter.none())).willReturn(List.of(
                video(1, 1L, "2024-01-10", PaymentState.PAID, "100.00"),
                video(2, 1L, "2024-01-11", PaymentState.PENDING, "50.00"),
                video(3, 9L, "2024-01-12", PaymentState.PAID, "999.00")));

        ExportedReport report = service(false).buildReport(ReportKind.PAYMENTS, ExportFormat.FLAT_TABLE);

        assertThat(report.diagnostics().skippedCount()).isEqualTo(1);
        assertThat(new String(report.content(), StandardCharsets.UTF_8)).isEqualTo(
                "Creator,Contact,Videos,Paid Total,Pending Total,Completion Ratio\n"
                        + "A,a@example.com,2,100.00,50.00,0.67\n");
    }

    @Test
    void filterIsPassedToRecordSource() {
        VideoFilter filter = new VideoFilter(1L, PaymentState.PENDING);
        given(recordSource.listCreators()).willReturn(List.of(creator(1, "A")));
        given(recordSource.listVideos(filter)).willReturn(List.of());

        service(false).buildReport(ReportKind.VIDEOS, ExportFormat.WORKBOOK, filter);

        verify(recordSource).listVideos(filter);
        verify(recordSource, never()).listVideos(VideoFilter.none());
    }

    @Test
    void aggregateHonorsZeroVideoCreatorSetting() {
        given(recordSource.listCreators()).willReturn(List.of(creator(1, "A"), creator(2, "B")));
        given(recordSource.listVideos(any())).willReturn(List.of(video(1, 1L, null, PaymentState.PAID, "5.00")));

        AggregationResult withZero = service(true).aggregate(VideoFilter.none());
        AggregationResult withoutZero = service(false).aggregate(VideoFilter.none());

        assertThat(withZero.summaries()).hasSize(2);
        assertThat(withoutZero.summaries()).hasSize(1);
    }

    private ReportService service(boolean includeZeroVideoCreators) {
        ReportProperties properties = TestRecords.properties(includeZeroVideoCreators, 60, 6);
        ReportExporter exporter = new ReportExporter(
                List.of(new CsvReportWriter(), new XlsxReportWriter(properties)), FIXED);
        return new ReportService(recordSource, new PaymentAggregator(), new ReportTableBuilder(), exporter, properties);
    }
}
