package com.example.payreport.infrastructure.export;

import com.example.payreport.application.exception.ReportSerializationException;
import com.example.payreport.application.export.CellValues;
import com.example.payreport.application.export.ReportWriter;
import com.example.payreport.domain.model.ExportFormat;
import com.example.payreport.domain.model.ReportTable;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes a single report table as comma-separated UTF-8 text with a header row.
 */
@Component
public class CsvReportWriter implements ReportWriter {

    private static final char DELIMITER = ',';
    private static final char QUOTE = '"';
    private static final String LINE_SEPARATOR = "\n";

    @Override
    public ExportFormat format() {
        return ExportFormat.FLAT_TABLE;
    }

	/**
	 * Renders the only table of the list.
	 *
	 * @param tables exactly one table
	 * @return CSV bytes
	 */
    @Override
    public byte[] write(List<ReportTable> tables) {
        if (tables.size() != 1) {
            throw new IllegalArgumentException("CSV output holds exactly one table, got " + tables.size());
        }
        return buildCsv(tables.get(0)).getBytes(StandardCharsets.UTF_8);
    }

	/**
	 * Builds the CSV output including the header row and escaped values.
	 *
	 * @param table table to render
	 * @return CSV document as a string
	 */
    String buildCsv(ReportTable table) {
        StringBuilder builder = new StringBuilder();
        appendRecord(builder, table.columnNames(), table, -1);
        List<List<Object>> rows = table.rows();
        for (int rowIndex = 0; rowIndex < rows.size(); rowIndex++) {
            appendRecord(builder, rows.get(rowIndex), table, rowIndex);
        }
        return builder.toString();
    }

    private void appendRecord(StringBuilder builder, List<?> cells, ReportTable table, int rowIndex) {
        for (int column = 0; column < cells.size(); column++) {
            if (column > 0) {
                builder.append(DELIMITER);
            }
            String rendered = CellValues.render(cells.get(column));
            builder.append(escape(rendered, table, rowIndex, column));
        }
        builder.append(LINE_SEPARATOR);
    }

	/**
	 * Quotes entries containing the delimiter, quotes, or line breaks and doubles embedded quotes.
	 * Other control characters have no CSV escape and are rejected.
	 */
    private String escape(String value, ReportTable table, int rowIndex, int column) {
        boolean needsQuoting = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == DELIMITER || c == QUOTE || c == '\n' || c == '\r') {
                needsQuoting = true;
            } else if (Character.isISOControl(c) && c != '\t') {
                throw new ReportSerializationException(table.sheetName(), rowIndex,
                        table.columnNames().get(column),
                        String.format("control character U+%04X cannot be written to CSV", (int) c));
            }
        }
        if (!needsQuoting) {
            return value;
        }
        return QUOTE + value.replace("\"", "\"\"") + QUOTE;
    }
}
