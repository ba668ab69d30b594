package com.example.payreport.infrastructure.export;

import com.example.payreport.application.exception.ReportSerializationException;
import com.example.payreport.domain.model.ReportColumn;
import com.example.payreport.domain.model.ReportKind;
import com.example.payreport.domain.model.ReportTable;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests verifying CSV escaping and value rendering.
 */
class CsvReportWriterTest {

    private static final List<ReportColumn> COLUMNS = List.of(
            ReportColumn.text("Title"),
            ReportColumn.date("Upload Date"),
            ReportColumn.integer("Videos"),
            ReportColumn.decimal("Amount"));

    private final CsvReportWriter writer = new CsvReportWriter();

    @Test
    void emptyTableRendersHeaderOnly() {
        ReportTable table = new ReportTable(ReportKind.CREATORS, COLUMNS, List.of());

        String csv = new String(writer.write(List.of(table)), StandardCharsets.UTF_8);

        assertThat(csv).isEqualTo("Title,Upload Date,Videos,Amount\n");
    }

    /**
     * Decimals use two fraction digits, dates use yyyy-MM-dd, and null renders as an empty field.
     */
    @Test
    void rendersTypedValues() {
        ReportTable table = table(row("Plain", LocalDate.of(2024, 3, 5), 3L, new BigDecimal("5")),
                row(null, null, null, new BigDecimal("0.6667")));

        String csv = new String(writer.write(List.of(table)), StandardCharsets.UTF_8);

        assertThat(csv).isEqualTo("Title,Upload Date,Videos,Amount\n"
                + "Plain,2024-03-05,3,5.00\n"
                + ",,,0.67\n");
    }

    @Test
    void quotesDelimitersQuotesAndLineBreaks() {
        ReportTable table = table(
                row("Recipes: pasta, soup", null, null, null),
                row("The \"quick\" one", null, null, null),
                row("line one\nline two", null, null, null),
                row("carriage\rreturn", null, null, null),
                row("tab\tinside", null, null, null));

        String csv = new String(writer.write(List.of(table)), StandardCharsets.UTF_8);

        assertThat(csv).contains("\"Recipes: pasta, soup\",,,\n");
        assertThat(csv).contains("\"The \"\"quick\"\" one\",,,\n");
        assertThat(csv).contains("\"line one\nline two\",,,\n");
        assertThat(csv).contains("\"carriage\rreturn\",,,\n");
        assertThat(csv).contains("tab\tinside,,,\n");
    }

    @Test
    void rejectsUnescapableControlCharacters() {
        ReportTable table = table(row("bell\u0007", null, null, null));

        ReportSerializationException ex = assertThrows(ReportSerializationException.class,
                () -> writer.write(List.of(table)));
        assertThat(ex.getMessage()).contains("U+0007").contains("Title");
    }

    @SafeVarargs
    private ReportTable table(List<Object>... rows) {
        return new ReportTable(ReportKind.VIDEOS, COLUMNS, Arrays.asList(rows));
    }

    private List<Object> row(Object... cells) {
        return Arrays.asList(cells);
    }
}
