package com.example.workbookmerge.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.example.workbookmerge.service.TestTables.row;
import static com.example.workbookmerge.service.TestTables.table;
import static com.example.workbookmerge.service.TestTables.workbook;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkbookMergeServiceTest {

    private static final List<String> COLUMNS = List.of("id", "val");

    @TempDir
    Path tempDir;

    private WorkbookMergeService service;
    private final WorkbookReader reader = new WorkbookReader();

    @BeforeEach
    void setUp() {
        service = new WorkbookMergeService(reader, TestTables.orchestrator(), TestTables.persistenceManager());
    }

    @Test
    void mergeAndSaveOverwritesBaseWithBackup() throws IOException {
        TableWorkbook original = workbook(
                "S1", table(COLUMNS, row(1.0, "a"), row(2.0, "b")),
                "S2", table(List.of("note"), row("static")));
        Path base = TestTables.writeFile(tempDir.resolve("base.xlsx"), original);
        Path incoming = TestTables.writeFile(tempDir.resolve("incoming.xlsx"),
                workbook("S1", table(COLUMNS, row(2.0, "b"), row(3.0, "c"))));

        MergeReport report = service.mergeFiles(base, incoming, null, true);

        assertTrue(report.saved());
        assertEquals(1, report.totalRowsAdded());
        assertEquals(List.of("S2"), report.passThroughSheets());
        assertEquals(base.toString(), report.outputPath());
        assertEquals(tempDir.resolve("base.backup.xlsx").toString(), report.backupPath());

        TableWorkbook saved = reader.read(base);
        assertEquals(table(COLUMNS, row(1.0, "a"), row(2.0, "b"), row(3.0, "c")), saved.sheet("S1"));
        assertEquals(original.sheet("S2"), saved.sheet("S2"));
        assertEquals(original, reader.read(tempDir.resolve("base.backup.xlsx")));
    }

    @Test
    void secondMergeOfSameFileAddsNothing() throws IOException {
        Path base = TestTables.writeFile(tempDir.resolve("base.xlsx"),
                workbook("S1", table(COLUMNS, row(1.0, "a"))));
        Path incoming = TestTables.writeFile(tempDir.resolve("incoming.xlsx"),
                workbook("S1", table(List.of("id", "extra"), row(2.0, "x"), row(3.0, "y"))));

        MergeReport first = service.mergeFiles(base, incoming, null, true);
        MergeReport second = service.mergeFiles(base, incoming, null, true);

        assertEquals(2, first.totalRowsAdded());
        assertEquals(0, second.totalRowsAdded());
        assertTrue(second.noOp());
        assertEquals(3, reader.read(base).sheet("S1").rowCount());
    }

    @Test
    void withoutSaveNothingOnDiskChanges() throws IOException {
        Path base = TestTables.writeFile(tempDir.resolve("base.xlsx"),
                workbook("S1", table(COLUMNS, row(1.0, "a"))));
        Path incoming = TestTables.writeFile(tempDir.resolve("incoming.xlsx"),
                workbook("S1", table(COLUMNS, row(2.0, "b"))));
        byte[] before = Files.readAllBytes(base);

        MergeReport report = service.mergeFiles(base, incoming, null, false);

        assertFalse(report.saved());
        assertNull(report.outputPath());
        assertEquals(1, report.totalRowsAdded());
        assertArrayEquals(before, Files.readAllBytes(base));
        assertFalse(Files.exists(tempDir.resolve("base.backup.xlsx")));
    }

    @Test
    void emptyIncomingSheetIsReportedAsNoOp() throws IOException {
        Path base = TestTables.writeFile(tempDir.resolve("base.xlsx"),
                workbook("S1", table(COLUMNS, row(1.0, "a"))));
        Path incoming = TestTables.writeFile(tempDir.resolve("incoming.xlsx"),
                workbook("S1", table(COLUMNS)));

        MergeReport report = service.mergeFiles(base, incoming, tempDir.resolve("out.xlsx"), true);

        assertTrue(report.noOp());
        assertEquals(0, report.totalRowsAdded());
        assertEquals(reader.read(base), reader.read(tempDir.resolve("out.xlsx")));
    }

    @Test
    void unreadableIncomingLeavesBaseUntouched() throws IOException {
        Path base = TestTables.writeFile(tempDir.resolve("base.xlsx"),
                workbook("S1", table(COLUMNS, row(1.0, "a"))));
        byte[] before = Files.readAllBytes(base);

        WorkbookMergeException e = assertThrows(WorkbookMergeException.class,
                () -> service.mergeFiles(base, tempDir.resolve("missing.xlsx"), null, true));

        assertEquals(FailureKind.SOURCE_UNREADABLE, e.kind());
        assertArrayEquals(before, Files.readAllBytes(base));
    }

    @Test
    void listsSheetNames() throws IOException {
        Path file = TestTables.writeFile(tempDir.resolve("book.xlsx"),
                workbook("B", table(COLUMNS), "A", table(COLUMNS)));

        assertEquals(List.of("B", "A"), service.listSheets(file));
    }
}
