package com.example.payreport.application.export;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Text rendering shared by every writer so that flat tables and workbook column widths agree.
 */
public final class CellValues {

    public static final int DECIMAL_SCALE = 2;
    public static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE;

    private CellValues() {
    }

	/**
	 * Renders a cell the way a flat table shows it: empty for {@code null}, two decimals for
	 * decimals, {@code yyyy-MM-dd} for dates, {@code toString()} for the rest.
	 *
	 * @param value cell value
	 * @return rendered text, never {@code null}
	 */
    public static String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.setScale(DECIMAL_SCALE, RoundingMode.HALF_UP).toPlainString();
        }
        if (value instanceof LocalDate date) {
            return DATE_FORMATTER.format(date);
        }
        return value.toString();
    }
}
