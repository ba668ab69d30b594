package com.example.payreport.domain.model;

import com.example.payreport.domain.exception.UnsupportedExportFormatException;

import java.util.Locale;

/**
 * Output formats understood by the exporter.
 */
public enum ExportFormat {
    FLAT_TABLE("csv", "text/csv"),
    WORKBOOK("xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final String fileExtension;
    private final String contentType;

    ExportFormat(String fileExtension, String contentType) {
        this.fileExtension = fileExtension;
        this.contentType = contentType;
    }

	/**
	 * Parses a request value. Accepts the enum names as well as the file extensions
	 * ({@code csv}, {@code xlsx}) and {@code excel}.
	 *
	 * @param rawValue value supplied by the caller
	 * @return parsed format
	 * @throws UnsupportedExportFormatException when the value is blank or unknown
	 */
    public static ExportFormat fromString(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            throw new UnsupportedExportFormatException(rawValue);
        }
        String normalized = rawValue.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "csv", "flat_table", "flat-table" -> FLAT_TABLE;
            case "xlsx", "excel", "workbook" -> WORKBOOK;
            default -> throw new UnsupportedExportFormatException(rawValue);
        };
    }

    public String fileExtension() {
        return fileExtension;
    }

    public String contentType() {
        return contentType;
    }
}
