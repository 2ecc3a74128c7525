package com.example.workbookmerge.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for merging one workbook file into another: load both, merge, and
 * optionally save over the base file or to another target.
 */
@Service
@RequiredArgsConstructor
public class WorkbookMergeService {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookMergeService.class);

    private final WorkbookReader workbookReader;
    private final WorkbookMergeOrchestrator orchestrator;
    private final PersistenceManager persistenceManager;

    public List<String> listSheets(Path path) {
        return workbookReader.sheetNames(path);
    }

    public MergeResult merge(Path basePath, Path incomingPath) {
        TableWorkbook base = workbookReader.read(basePath);
        TableWorkbook incoming = workbookReader.read(incomingPath);
        return orchestrator.mergeWorkbooks(base, incoming);
    }

    /**
     * @param targetPath where to save; {@code null} overwrites the base file
     * @param save       {@code false} computes the merge without touching the disk
     */
    public MergeReport mergeFiles(Path basePath, Path incomingPath, Path targetPath, boolean save) {
        if (basePath == null || incomingPath == null) {
            throw new IllegalArgumentException("Both a base and an incoming workbook are required.");
        }
        MergeResult result;
        try {
            result = merge(basePath, incomingPath);
        } catch (WorkbookMergeException e) {
            logger.error("Merge of {} into {} failed: {}", incomingPath, basePath, e.getMessage());
            throw e;
        }

        if (result.isNoOp()) {
            logger.info("No new unique rows found to add");
        }
        logStatistics(result);

        if (!save) {
            logger.info("Merged workbook not saved (save not requested)");
            return toReport(result, null);
        }
        Path target = targetPath == null ? basePath : targetPath;
        PersistResult persisted;
        try {
            persisted = persistenceManager.persist(basePath, result.merged(), target);
        } catch (WorkbookMergeException e) {
            logger.error("Saving merged workbook to {} failed: {}", target, e.getMessage());
            throw e;
        }
        return toReport(result, persisted);
    }

    private void logStatistics(MergeResult result) {
        logger.info("Sheets processed: {}, total original rows: {}, rows after merge: {}, new rows added: {}",
                result.sheetStats().size(), result.totalOriginalRows(), result.totalFinalRows(),
                result.totalRowsAdded());
        for (SheetStats stats : result.sheetStats()) {
            logger.info("  {}: {} -> {} (+{})", stats.sheetName(), stats.originalRowCount(),
                    stats.finalRowCount(), stats.rowsAdded());
        }
    }

    private MergeReport toReport(MergeResult result, PersistResult persisted) {
        return new MergeReport(
                result.mode(),
                result.merged().sheetNames(),
                result.sheetStats(),
                result.passThroughSheets(),
                result.droppedIncomingSheets(),
                result.totalOriginalRows(),
                result.totalFinalRows(),
                result.totalRowsAdded(),
                result.isNoOp(),
                persisted != null,
                persisted == null ? null : persisted.target().toString(),
                persisted == null ? null : persisted.backup().toString()
        );
    }
}
