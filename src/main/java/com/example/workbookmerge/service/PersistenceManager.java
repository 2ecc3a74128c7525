package com.example.workbookmerge.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Saves a merged workbook. The original base workbook is always backed up first, as a
 * byte-for-byte copy named {@code <stem><suffix><ext>} next to it; no output is written
 * if that fails. The output goes to a temp file next to the target which then replaces
 * the target.
 */
@Component
public class PersistenceManager {

    private static final Logger logger = LoggerFactory.getLogger(PersistenceManager.class);
    private static final String XLSX_EXTENSION = ".xlsx";

    private final WorkbookReader workbookReader;
    private final WorkbookWriter workbookWriter;
    private final String backupSuffix;

    public PersistenceManager(WorkbookReader workbookReader,
                              WorkbookWriter workbookWriter,
                              @Value("${workbook.merge.backup-suffix:.backup}") String backupSuffix) {
        this.workbookReader = workbookReader;
        this.workbookWriter = workbookWriter;
        this.backupSuffix = backupSuffix;
    }

    public PersistResult persist(Path originalBasePath, TableWorkbook merged, Path targetPath) {
        return persist(originalBasePath, merged, targetPath, backupSuffix);
    }

    public PersistResult persist(Path originalBasePath, TableWorkbook merged, Path targetPath, String suffix) {
        Path backup = backup(originalBasePath, suffix);
        write(merged, targetPath);
        return new PersistResult(targetPath, backup);
    }

    public Path backupPathFor(Path originalBasePath) {
        return backupPathFor(originalBasePath, backupSuffix);
    }

    public Path backupPathFor(Path originalBasePath, String suffix) {
        String fileName = originalBasePath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : XLSX_EXTENSION;
        return originalBasePath.resolveSibling(stem + suffix + extension);
    }

    private Path backup(Path originalBasePath, String suffix) {
        try {
            workbookReader.read(originalBasePath);
        } catch (WorkbookMergeException e) {
            throw new WorkbookMergeException(MergeStage.PERSIST, FailureKind.BACKUP_FAILURE,
                    "Backup aborted, original workbook is unreadable: " + e.getMessage(), e);
        }

        Path backup = backupPathFor(originalBasePath, suffix);
        try {
            replaceVia(backup, temp -> Files.copy(originalBasePath, temp, StandardCopyOption.REPLACE_EXISTING));
        } catch (IOException | RuntimeException e) {
            throw new WorkbookMergeException(MergeStage.PERSIST, FailureKind.BACKUP_FAILURE,
                    "Cannot write backup " + backup + ": " + e.getMessage(), e);
        }
        logger.info("Backup created: {}", backup);
        return backup;
    }

    private void write(TableWorkbook merged, Path targetPath) {
        logger.info("Saving merged workbook to: {}", targetPath);
        try {
            replaceVia(targetPath, temp -> workbookWriter.write(merged, temp));
        } catch (IOException | RuntimeException e) {
            throw new WorkbookMergeException(MergeStage.PERSIST, FailureKind.WRITE_FAILURE,
                    "Cannot write " + targetPath + ": " + e.getMessage(), e);
        }
        for (String sheet : merged.sheetNames()) {
            logger.info("Saved sheet '{}' with {} rows", sheet, merged.sheet(sheet).rowCount());
        }
    }

    private void replaceVia(Path destination, TempFileWriter writer) throws IOException {
        Path dir = destination.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path temp = Files.createTempFile(dir, "." + destination.getFileName(), ".tmp");
        try {
            writer.writeTo(temp);
            moveIntoPlace(temp, destination);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private void moveIntoPlace(Path temp, Path destination) throws IOException {
        try {
            Files.move(temp, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, replacing instead", destination);
            Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @FunctionalInterface
    private interface TempFileWriter {
        void writeTo(Path temp) throws IOException;
    }
}
