package com.example.payreport.domain.model;

/**
 * Named, typed column of a {@link ReportTable}.
 */
public record ReportColumn(String name, ColumnType type) {

    public static ReportColumn text(String name) {
        return new ReportColumn(name, ColumnType.TEXT);
    }

    public static ReportColumn integer(String name) {
        return new ReportColumn(name, ColumnType.INTEGER);
    }

    public static ReportColumn decimal(String name) {
        return new ReportColumn(name, ColumnType.DECIMAL);
    }

    public static ReportColumn date(String name) {
        return new ReportColumn(name, ColumnType.DATE);
    }
}
