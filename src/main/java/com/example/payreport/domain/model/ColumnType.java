package com.example.payreport.domain.model;

/**
 * Value type of a report column. Writers choose the rendering from this, never from the column name.
 */
public enum ColumnType {
    TEXT,
    INTEGER,
    DECIMAL,
    DATE
}
