package com.example.payreport.application.service;

import com.example.payreport.application.exception.EmptyInputException;
import com.example.payreport.application.exception.FormatMismatchException;
import com.example.payreport.application.export.ReportWriter;
import com.example.payreport.domain.model.ExportFormat;
import com.example.payreport.domain.model.ExportedReport;
import com.example.payreport.domain.model.ReportDiagnostics;
import com.example.payreport.domain.model.ReportKind;
import com.example.payreport.domain.model.ReportTable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Application-layer service that checks table counts against the requested format, delegates to the
 * matching {@link ReportWriter} and attaches a download file name.
 */
@Service
public class ReportExporter {

    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final Map<ExportFormat, ReportWriter> writers = new EnumMap<>(ExportFormat.class);
    private final Clock clock;

	/**
	 * Creates the exporter with one writer per supported format.
	 *
	 * @param writers available writers; a later writer for the same format replaces an earlier one
	 * @param clock   source of the date embedded in file names
	 */
    public ReportExporter(List<ReportWriter> writers, Clock clock) {
        for (ReportWriter writer : writers) {
            this.writers.put(writer.format(), writer);
        }
        this.clock = clock;
    }

	/**
	 * Serializes the tables of a report.
	 *
	 * @param kind        report kind, used for the file name
	 * @param tables      tables produced for that kind
	 * @param format      requested output format
	 * @param diagnostics skipped-record information to pass through to the caller
	 * @return payload, file name and diagnostics
	 * @throws EmptyInputException     when a workbook is requested without tables
	 * @throws FormatMismatchException when a flat table is requested for anything but one table
	 */
    public ExportedReport export(ReportKind kind,
                                 List<ReportTable> tables,
                                 ExportFormat format,
                                 ReportDiagnostics diagnostics) {
        int tableCount = tables == null ? 0 : tables.size();
        if (format == ExportFormat.FLAT_TABLE && tableCount != 1) {
            throw new FormatMismatchException(format, tableCount);
        }
        if (tableCount == 0) {
            throw new EmptyInputException("No report tables were supplied for export.");
        }
        ReportWriter writer = writers.get(format);
        if (writer == null) {
            throw new IllegalStateException("No writer registered for format " + format);
        }
        byte[] content = writer.write(tables);
        return new ExportedReport(content, fileName(kind, format), format,
                diagnostics == null ? ReportDiagnostics.clean() : diagnostics);
    }

	/**
	 * Builds an ASCII-only download name such as {@code payments_export_20240301.csv}.
	 *
	 * @param kind   report kind
	 * @param format output format
	 * @return file name without any path separator
	 */
    public String fileName(ReportKind kind, ExportFormat format) {
        String raw = kind.label() + "_export_" + FILE_DATE.format(LocalDate.now(clock)) + "." + format.fileExtension();
        return raw.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]", "_");
    }
}
