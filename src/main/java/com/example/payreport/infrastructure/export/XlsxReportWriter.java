package com.example.payreport.infrastructure.export;

import com.example.payreport.application.exception.ReportSerializationException;
import com.example.payreport.application.export.CellValues;
import com.example.payreport.application.export.ReportWriter;
import com.example.payreport.domain.model.ColumnType;
import com.example.payreport.domain.model.ExportFormat;
import com.example.payreport.domain.model.ReportColumn;
import com.example.payreport.domain.model.ReportTable;
import com.example.payreport.infrastructure.config.ReportProperties;
import com.example.payreport.infrastructure.exception.ReportRenderingException;

import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.DataFormat;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Infrastructure writer that renders report tables into an Office Open XML workbook with Apache POI,
 * one sheet per table. Hides the POI cell and style handling from the application layer.
 */
@Component
public class XlsxReportWriter implements ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(XlsxReportWriter.class);
    private static final int MAX_SHEET_NAME_LENGTH = 31;
    private static final int MAX_POI_COLUMN_WIDTH = 255;
    private static final int WIDTH_PADDING = 2;

    private final int maxColumnWidth;

	/**
	 * Creates the writer with the configured column width cap.
	 *
	 * @param properties reporting configuration
	 */
    public XlsxReportWriter(ReportProperties properties) {
        this.maxColumnWidth = Math.max(1, Math.min(properties.workbook().maxColumnWidth(), MAX_POI_COLUMN_WIDTH));
    }

    @Override
    public ExportFormat format() {
        return ExportFormat.WORKBOOK;
    }

	/**
	 * Renders every table as its own sheet, in list order.
	 *
	 * @param tables one or more tables
	 * @return workbook bytes
	 * @throws ReportSerializationException when a value does not fit its cell
	 * @throws ReportRenderingException     when POI fails to write the package
	 */
    @Override
    public byte[] write(List<ReportTable> tables) {
        try (XSSFWorkbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Styles styles = new Styles(workbook);
            Set<String> usedNames = new HashSet<>();
            for (ReportTable table : tables) {
                writeSheet(workbook, styles, uniqueSheetName(table.sheetName(), usedNames), table);
            }
            workbook.write(out);
            return out.toByteArray();
        } catch (IOException ex) {
            log.error("Failed to write workbook with {} sheets", tables.size(), ex);
            throw new ReportRenderingException("Unable to write the workbook.", ex);
        }
    }

    private void writeSheet(Workbook workbook, Styles styles, String sheetName, ReportTable table) {
        Sheet sheet = workbook.createSheet(sheetName);
        List<ReportColumn> columns = table.columns();
        int[] widths = new int[columns.size()];

        Row header = sheet.createRow(0);
        for (int column = 0; column < columns.size(); column++) {
            Cell cell = header.createCell(column);
            cell.setCellValue(columns.get(column).name());
            cell.setCellStyle(styles.header);
            widths[column] = columns.get(column).name().length();
        }

        List<List<Object>> rows = table.rows();
        for (int rowIndex = 0; rowIndex < rows.size(); rowIndex++) {
            Row row = sheet.createRow(rowIndex + 1);
            List<Object> values = rows.get(rowIndex);
            for (int column = 0; column < columns.size(); column++) {
                Object value = values.get(column);
                if (value == null) {
                    continue;
                }
                writeCell(row.createCell(column), columns.get(column), value, styles, table, rowIndex);
                widths[column] = Math.max(widths[column], CellValues.render(value).length());
            }
        }

        for (int column = 0; column < widths.length; column++) {
            int width = Math.min(widths[column] + WIDTH_PADDING, maxColumnWidth);
            sheet.setColumnWidth(column, width * 256);
        }
        sheet.createFreezePane(0, 1);
    }

    private void writeCell(Cell cell, ReportColumn column, Object value, Styles styles, ReportTable table, int rowIndex) {
        ColumnType type = column.type();
        switch (type) {
            case INTEGER, DECIMAL -> {
                if (!(value instanceof Number number)) {
                    throw mismatch(table, rowIndex, column, value);
                }
                double numeric = number instanceof BigDecimal decimal ? decimal.doubleValue() : number.doubleValue();
                cell.setCellValue(numeric);
                cell.setCellStyle(type == ColumnType.INTEGER ? styles.integer : styles.decimal);
            }
            case DATE -> {
                if (!(value instanceof LocalDate date)) {
                    throw mismatch(table, rowIndex, column, value);
                }
                cell.setCellValue(date);
                cell.setCellStyle(styles.date);
            }
            case TEXT -> {
                String text = CellValues.render(value);
                if (text.length() > SpreadsheetVersion.EXCEL2007.getMaxTextLength()) {
                    throw new ReportSerializationException(table.sheetName(), rowIndex, column.name(),
                            "text of " + text.length() + " characters exceeds the workbook cell limit of "
                                    + SpreadsheetVersion.EXCEL2007.getMaxTextLength());
                }
                cell.setCellValue(text);
            }
        }
    }

    private ReportSerializationException mismatch(ReportTable table, int rowIndex, ReportColumn column, Object value) {
        return new ReportSerializationException(table.sheetName(), rowIndex, column.name(),
                value.getClass().getSimpleName() + " is not a valid " + column.type().name().toLowerCase(Locale.ROOT)
                        + " value");
    }

	/**
	 * Sanitizes a sheet name for the workbook and keeps it unique within the workbook.
	 *
	 * @param requested desired name
	 * @param usedNames names already taken, case-insensitively
	 * @return safe, unique sheet name
	 */
    static String uniqueSheetName(String requested, Set<String> usedNames) {
        String base = WorkbookUtil.createSafeSheetName(requested);
        String candidate = base;
        int suffix = 2;
        while (usedNames.contains(candidate.toLowerCase(Locale.ROOT))) {
            String tail = " (" + suffix++ + ")";
            candidate = base.substring(0, Math.min(base.length(), MAX_SHEET_NAME_LENGTH - tail.length())) + tail;
        }
        usedNames.add(candidate.toLowerCase(Locale.ROOT));
        return candidate;
    }

    private static final class Styles {
        private final CellStyle header;
        private final CellStyle integer;
        private final CellStyle decimal;
        private final CellStyle date;

        private Styles(Workbook workbook) {
            DataFormat format = workbook.createDataFormat();
            Font bold = workbook.createFont();
            bold.setBold(true);
            header = workbook.createCellStyle();
            header.setFont(bold);
            integer = workbook.createCellStyle();
            integer.setDataFormat(format.getFormat("0"));
            decimal = workbook.createCellStyle();
            decimal.setDataFormat(format.getFormat("0.00"));
            date = workbook.createCellStyle();
            date.setDataFormat(format.getFormat("yyyy-mm-dd"));
        }
    }
}
