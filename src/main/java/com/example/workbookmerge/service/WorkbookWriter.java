package com.example.workbookmerge.service;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CreationHelper;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Writes a {@link TableWorkbook} as {@code .xlsx}: one header row of column names, then
 * one row per table row. {@code null} cells are left empty.
 */
@Component
public class WorkbookWriter {

    private static final String DATE_TIME_FORMAT = "yyyy-mm-dd hh:mm:ss";
    private static final String TIME_FORMAT = "hh:mm:ss";
    private static final double NANOS_PER_DAY = TimeUnit.DAYS.toNanos(1);

    public void write(TableWorkbook tables, Path path) throws IOException {
        try (OutputStream out = Files.newOutputStream(path)) {
            write(tables, out);
        }
    }

    public void write(TableWorkbook tables, OutputStream out) throws IOException {
        if (tables.isEmpty()) {
            throw new IllegalArgumentException("A workbook needs at least one sheet");
        }
        try (Workbook workbook = new XSSFWorkbook()) {
            CreationHelper helper = workbook.getCreationHelper();
            CellStyles styles = new CellStyles(
                    style(workbook, helper, DATE_TIME_FORMAT), style(workbook, helper, TIME_FORMAT));

            for (Map.Entry<String, Table> entry : tables.sheets().entrySet()) {
                writeSheet(workbook.createSheet(entry.getKey()), entry.getValue(), styles);
            }
            workbook.write(out);
        }
    }

    private static CellStyle style(Workbook workbook, CreationHelper helper, String format) {
        CellStyle style = workbook.createCellStyle();
        style.setDataFormat(helper.createDataFormat().getFormat(format));
        return style;
    }

    private void writeSheet(Sheet sheet, Table table, CellStyles styles) {
        List<String> columns = table.columns();
        if (columns.isEmpty()) {
            return;
        }
        Row header = sheet.createRow(0);
        for (int c = 0; c < columns.size(); c++) {
            header.createCell(c).setCellValue(columns.get(c));
        }

        for (int r = 0; r < table.rowCount(); r++) {
            Row row = sheet.createRow(r + 1);
            List<Object> values = table.row(r);
            for (int c = 0; c < values.size(); c++) {
                Object value = values.get(c);
                if (value != null) {
                    setCellValue(row.createCell(c), value, styles);
                }
            }
        }
    }

    private void setCellValue(Cell cell, Object value, CellStyles styles) {
        if (value instanceof Number) {
            cell.setCellValue(((Number) value).doubleValue());
        } else if (value instanceof Boolean) {
            cell.setCellValue((Boolean) value);
        } else if (value instanceof LocalDateTime) {
            cell.setCellValue((LocalDateTime) value);
            cell.setCellStyle(styles.dateTime());
        } else if (value instanceof LocalDate) {
            cell.setCellValue((LocalDate) value);
            cell.setCellStyle(styles.dateTime());
        } else if (value instanceof LocalTime) {
            // fraction of a day, the serial form Excel uses for times
            cell.setCellValue(((LocalTime) value).toNanoOfDay() / NANOS_PER_DAY);
            cell.setCellStyle(styles.time());
        } else {
            cell.setCellValue(value.toString());
        }
    }

    private record CellStyles(CellStyle dateTime, CellStyle time) {
    }
}
