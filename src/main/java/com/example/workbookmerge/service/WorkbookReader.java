package com.example.workbookmerge.service;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads every sheet of an {@code .xlsx} or {@code .xls} file into memory. The first row
 * of a sheet is its header row; rows with no content are skipped. Date-formatted cells
 * become {@code LocalDateTime}, or {@code LocalTime} when the value is a time of day only.
 */
@Component
public class WorkbookReader {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookReader.class);
    private static final String UNNAMED_PREFIX = "Unnamed: ";

    public List<String> sheetNames(Path path) {
        try (Workbook workbook = open(path)) {
            List<String> names = new ArrayList<>();
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                names.add(workbook.getSheetName(i));
            }
            return names;
        } catch (IOException e) {
            throw unreadable(path, e);
        }
    }

    public TableWorkbook read(Path path) {
        try (Workbook workbook = open(path)) {
            DataFormatter fmt = new DataFormatter();
            Map<String, Table> sheets = new LinkedHashMap<>();
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                Sheet sheet = workbook.getSheetAt(i);
                Table table = readSheet(sheet, fmt);
                logger.info("Loaded sheet '{}' from {}: {} rows, {} columns",
                        sheet.getSheetName(), path.getFileName(), table.rowCount(), table.columns().size());
                sheets.put(sheet.getSheetName(), table);
            }
            return TableWorkbook.of(sheets);
        } catch (IOException e) {
            throw unreadable(path, e);
        }
    }

    private Workbook open(Path path) throws IOException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new WorkbookMergeException(MergeStage.RESOLVE, FailureKind.SOURCE_UNREADABLE,
                    "Workbook not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return WorkbookFactory.create(in);
        } catch (RuntimeException e) {
            // POI reports malformed content with unchecked exceptions
            throw new WorkbookMergeException(MergeStage.RESOLVE, FailureKind.SOURCE_UNREADABLE,
                    "Cannot parse workbook " + path + ": " + e.getMessage(), e);
        }
    }

    Table readSheet(Sheet sheet, DataFormatter fmt) {
        if (sheet.getPhysicalNumberOfRows() == 0) {
            return Table.empty(List.of());
        }
        int headerIndex = sheet.getFirstRowNum();
        Row headerRow = sheet.getRow(headerIndex);

        int width = headerRow == null ? 0 : Math.max(0, headerRow.getLastCellNum());
        for (int r = headerIndex + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row != null) {
                width = Math.max(width, row.getLastCellNum());
            }
        }

        List<String> columns = buildColumns(headerRow, width, fmt);
        List<List<Object>> rows = new ArrayList<>();
        for (int r = headerIndex + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                continue;
            }
            List<Object> values = new ArrayList<>(width);
            boolean hasContent = false;
            for (int c = 0; c < width; c++) {
                Object value = cellValue(row.getCell(c));
                if (value != null) {
                    hasContent = true;
                }
                values.add(value);
            }
            if (hasContent) {
                rows.add(values);
            }
        }
        return Table.of(columns, rows);
    }

    private List<String> buildColumns(Row headerRow, int width, DataFormatter fmt) {
        List<String> columns = new ArrayList<>(width);
        Set<String> seen = new HashSet<>();
        for (int c = 0; c < width; c++) {
            Cell cell = headerRow == null ? null : headerRow.getCell(c);
            String name = cell == null ? "" : fmt.formatCellValue(cell).trim();
            if (name.isBlank()) {
                name = UNNAMED_PREFIX + c;
            }
            String unique = name;
            int n = 1;
            while (!seen.add(unique)) {
                unique = name + "." + n++;
            }
            columns.add(unique);
        }
        return columns;
    }

    private Object cellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType cellType = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        if (cellType == CellType.NUMERIC) {
            if (DateUtil.isCellDateFormatted(cell)) {
                // serials below one day carry no date part
                if (cell.getNumericCellValue() < 1.0) {
                    return cell.getLocalDateTimeCellValue().toLocalTime();
                }
                return cell.getLocalDateTimeCellValue();
            }
            return cell.getNumericCellValue();
        }
        if (cellType == CellType.STRING) {
            String value = cell.getStringCellValue();
            return value == null || value.isEmpty() ? null : value;
        }
        if (cellType == CellType.BOOLEAN) {
            return cell.getBooleanCellValue();
        }
        if (cellType == CellType.ERROR) {
            return FormulaError.forInt(cell.getErrorCellValue()).getString();
        }
        return null;
    }

    private WorkbookMergeException unreadable(Path path, IOException e) {
        return new WorkbookMergeException(MergeStage.RESOLVE, FailureKind.SOURCE_UNREADABLE,
                "Cannot read workbook " + path + ": " + e.getMessage(), e);
    }
}
