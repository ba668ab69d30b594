package com.example.payreport.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One exportable sheet: a fixed column schema plus rows aligned to it.
 * Row cells hold {@code String}, {@code Long}, {@code BigDecimal}, {@code LocalDate} or {@code null}
 * according to the column's {@link ColumnType}. Instances are immutable.
 */
public record ReportTable(
        ReportKind kind,
        List<ReportColumn> columns,
        List<List<Object>> rows
) {

    public ReportTable {
        if (kind == null || kind == ReportKind.COMBINED) {
            throw new IllegalArgumentException("A report table needs a single report kind, got " + kind);
        }
        columns = List.copyOf(columns);
        List<List<Object>> copies = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException("Row has " + row.size() + " cells but table "
                        + kind.label() + " defines " + columns.size() + " columns");
            }
            copies.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = Collections.unmodifiableList(copies);
    }

	/**
	 * @return header labels in column order
	 */
    public List<String> columnNames() {
        return columns.stream().map(ReportColumn::name).toList();
    }

    public String sheetName() {
        return kind.label();
    }
}
