package com.example.payreport.domain.model;

/**
 * Rendered export payload handed to the transport layer.
 *
 * @param content     serialized bytes
 * @param fileName    ASCII-safe download name, e.g. {@code payments_export_20240301.csv}
 * @param format      format the content was serialized with
 * @param diagnostics records skipped while deriving the report
 */
public record ExportedReport(
        byte[] content,
        String fileName,
        ExportFormat format,
        ReportDiagnostics diagnostics
) {

    public String contentType() {
        return format.contentType();
    }
}
