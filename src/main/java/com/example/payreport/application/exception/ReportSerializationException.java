package com.example.payreport.application.exception;

/**
 * Thrown by report writers when a cell value cannot be represented in the target format.
 */
public class ReportSerializationException extends ApplicationException {

	/**
	 * @param sheet  table the offending value belongs to
	 * @param row    zero-based data row index
	 * @param column column header
	 * @param reason what makes the value unrepresentable
	 */
    public ReportSerializationException(String sheet, int row, String column, String reason) {
        super("Cannot serialize value in " + sheet + " row " + (row + 1) + ", column '" + column + "': " + reason);
    }
}
