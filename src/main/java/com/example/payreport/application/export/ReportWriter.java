package com.example.payreport.application.export;

import com.example.payreport.application.exception.ReportSerializationException;
import com.example.payreport.domain.model.ExportFormat;
import com.example.payreport.domain.model.ReportTable;

import java.util.List;

/**
 * Serializes report tables into one output format. Implementations are format-only: they render
 * whatever columns a table declares and know nothing about report kinds.
 */
public interface ReportWriter {

	/**
	 * @return format produced by this writer
	 */
    ExportFormat format();

	/**
	 * Serializes the tables. Callers have already checked that the table count suits the format.
	 *
	 * @param tables tables to render, in output order
	 * @return serialized payload
	 * @throws ReportSerializationException when a value cannot be represented
	 */
    byte[] write(List<ReportTable> tables);
}
