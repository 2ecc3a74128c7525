package com.example.workbookmerge.service;

import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalTime;
import java.util.List;
import java.util.stream.Stream;

import static com.example.workbookmerge.service.TestTables.row;
import static com.example.workbookmerge.service.TestTables.table;
import static com.example.workbookmerge.service.TestTables.workbook;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PersistenceManagerTest {

    private static final List<String> COLUMNS = List.of("id", "val");

    @TempDir
    Path tempDir;

    private final PersistenceManager persistenceManager = TestTables.persistenceManager();
    private final WorkbookReader reader = new WorkbookReader();

    @Test
    void backupPathIsADeterministicSibling() {
        Path base = tempDir.resolve("lots.xlsx");

        assertEquals(tempDir.resolve("lots.backup.xlsx"), persistenceManager.backupPathFor(base));
        assertEquals(tempDir.resolve("lots.yield_backup.xlsx"), persistenceManager.backupPathFor(base, ".yield_backup"));
        assertEquals(tempDir.resolve("old.backup.xls"), persistenceManager.backupPathFor(tempDir.resolve("old.xls")));
    }

    @Test
    void overwritingBaseKeepsEveryOriginalSheetInTheBackup() throws IOException {
        TableWorkbook original = workbook(
                "S1", table(COLUMNS, row(1.0, "a")),
                "S2", table(List.of("note"), row("untouched")));
        Path base = TestTables.writeFile(tempDir.resolve("base.xlsx"), original);
        TableWorkbook merged = workbook(
                "S1", table(COLUMNS, row(1.0, "a"), row(2.0, "b")),
                "S2", table(List.of("note"), row("untouched")));

        PersistResult result = persistenceManager.persist(base, merged, base);

        assertEquals(base, result.target());
        assertEquals(tempDir.resolve("base.backup.xlsx"), result.backup());
        assertEquals(original, reader.read(result.backup()));
        assertEquals(merged, reader.read(base));
    }

    @Test
    void writesToSeparateTargetAndLeavesBaseAlone() throws IOException {
        Path base = TestTables.writeFile(tempDir.resolve("base.xlsx"), workbook("S1", table(COLUMNS, row(1.0, "a"))));
        byte[] before = Files.readAllBytes(base);
        Path target = tempDir.resolve("out").resolve("merged.xlsx");
        TableWorkbook merged = workbook("S1", table(COLUMNS, row(1.0, "a"), row(2.0, "b")));

        persistenceManager.persist(base, merged, target);

        assertArrayEquals(before, Files.readAllBytes(base));
        assertEquals(merged, reader.read(target));
    }

    @Test
    void unreadableBaseAbortsBeforeAnythingIsWritten() throws IOException {
        Path base = Files.writeString(tempDir.resolve("broken.xlsx"), "garbage");
        Path target = tempDir.resolve("target.xlsx");

        WorkbookMergeException e = assertThrows(WorkbookMergeException.class,
                () -> persistenceManager.persist(base, workbook("S1", table(COLUMNS)), target));

        assertEquals(FailureKind.BACKUP_FAILURE, e.kind());
        assertEquals(MergeStage.PERSIST, e.stage());
        assertFalse(Files.exists(target));
        assertEquals("garbage", Files.readString(base));
    }

    @Test
    void failedWriteKeepsBackupAndLeavesNoTempFiles() throws IOException {
        TableWorkbook original = workbook("S1", table(COLUMNS, row(1.0, "a")));
        Path base = TestTables.writeFile(tempDir.resolve("base.xlsx"), original);
        Path target = tempDir.resolve("occupied");
        Files.createDirectories(target);
        Files.writeString(target.resolve("keep.txt"), "x");

        WorkbookMergeException e = assertThrows(WorkbookMergeException.class,
                () -> persistenceManager.persist(base, original, target));

        assertEquals(FailureKind.WRITE_FAILURE, e.kind());
        assertTrue(Files.exists(tempDir.resolve("base.backup.xlsx")));
        try (Stream<Path> files = Files.list(tempDir)) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    void backupKeepsFormulasAndFormatsOfTheOriginal() throws IOException {
        Path base = tempDir.resolve("formulas.xlsx");
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("S1");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("pass");
            header.createCell(1).setCellValue("total");
            header.createCell(2).setCellValue("ratio");
            Row data = sheet.createRow(1);
            data.createCell(0).setCellValue(9);
            data.createCell(1).setCellValue(10);
            data.createCell(2).setCellFormula("A2/B2");
            workbook.getCreationHelper().createFormulaEvaluator().evaluateAll();
            try (OutputStream out = Files.newOutputStream(base)) {
                workbook.write(out);
            }
        }
        byte[] before = Files.readAllBytes(base);

        PersistResult result = persistenceManager.persist(base, reader.read(base), base);

        assertArrayEquals(before, Files.readAllBytes(result.backup()));
        try (InputStream in = Files.newInputStream(result.backup());
             Workbook backup = WorkbookFactory.create(in)) {
            Cell ratio = backup.getSheet("S1").getRow(1).getCell(2);
            assertEquals(CellType.FORMULA, ratio.getCellType());
            assertEquals("A2/B2", ratio.getCellFormula());
        }
    }

    @Test
    void xlsBaseIsBackedUpAsXls() throws IOException {
        Path base = tempDir.resolve("legacy.xls");
        try (Workbook workbook = new HSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("S1");
            sheet.createRow(0).createCell(0).setCellValue("id");
            sheet.createRow(1).createCell(0).setCellValue(1);
            try (OutputStream out = Files.newOutputStream(base)) {
                workbook.write(out);
            }
        }
        byte[] before = Files.readAllBytes(base);

        PersistResult result = persistenceManager.persist(base, reader.read(base), tempDir.resolve("merged.xlsx"));

        assertEquals(tempDir.resolve("legacy.backup.xls"), result.backup());
        assertArrayEquals(before, Files.readAllBytes(result.backup()));
    }

    @Test
    void inPlaceSaveKeepsTimeOfDayColumns() throws IOException {
        Path base = tempDir.resolve("times.xlsx");
        try (Workbook workbook = new XSSFWorkbook()) {
            CellStyle timeStyle = workbook.createCellStyle();
            timeStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("hh:mm:ss"));
            Sheet sheet = workbook.createSheet("S1");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("lot");
            header.createCell(1).setCellValue("test_time");
            Row data = sheet.createRow(1);
            data.createCell(0).setCellValue(1);
            data.createCell(1).setCellValue(0.5);
            data.getCell(1).setCellStyle(timeStyle);
            try (OutputStream out = Files.newOutputStream(base)) {
                workbook.write(out);
            }
        }
        TableWorkbook before = reader.read(base);

        PersistResult result = persistenceManager.persist(base, before, base);

        assertEquals(LocalTime.NOON, before.sheet("S1").value(0, "test_time"));
        assertEquals(before, reader.read(result.backup()));
        assertEquals(before, reader.read(base));
    }
}
