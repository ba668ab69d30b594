package com.example.payreport.application.exception;

import com.example.payreport.domain.model.ExportFormat;

/**
 * Thrown when the number of tables does not fit the requested format, e.g. a combined report
 * requested as a flat table.
 */
public class FormatMismatchException extends UseCaseValidationException {

	/**
	 * @param format     requested output format
	 * @param tableCount number of tables that were supplied
	 */
    public FormatMismatchException(ExportFormat format, int tableCount) {
        super("Format " + format.fileExtension() + " holds exactly one table but " + tableCount
                + " were supplied. Use xlsx for multi-table reports.");
    }
}
