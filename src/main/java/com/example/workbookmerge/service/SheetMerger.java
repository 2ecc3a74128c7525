package com.example.workbookmerge.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Merges one incoming table into one base table: align columns, drop rows the base
 * already holds, append the rest after the base rows.
 */
@Component
@RequiredArgsConstructor
public class SheetMerger {

    private static final Logger logger = LoggerFactory.getLogger(SheetMerger.class);

    private final ColumnAligner columnAligner;
    private final DuplicateDetector duplicateDetector;

    public SheetMergeOutcome mergeSheet(String sheetName, Table base, Table incoming) {
        logger.info("Processing sheet: {}", sheetName);

        AlignedTables aligned;
        try {
            aligned = columnAligner.align(base, incoming);
        } catch (RuntimeException e) {
            throw new WorkbookMergeException(MergeStage.ALIGN, FailureKind.INTERNAL_ERROR,
                    "Column alignment failed for sheet '" + sheetName + "': " + e.getMessage(), e);
        }

        Table fresh;
        try {
            fresh = duplicateDetector.findNew(aligned.base(), aligned.incoming());
        } catch (RuntimeException e) {
            throw new WorkbookMergeException(MergeStage.DETECT, FailureKind.INTERNAL_ERROR,
                    "Duplicate detection failed for sheet '" + sheetName + "': " + e.getMessage(), e);
        }

        if (fresh.isEmpty()) {
            logger.info("No new unique rows found in sheet '{}'", sheetName);
            return new SheetMergeOutcome(sheetName, aligned.base(), base.rowCount(), 0);
        }

        Table merged = aligned.base().appendRows(fresh.rows());
        logger.info("Sheet '{}' merge completed. Rows: {} -> {} (+{})",
                sheetName, base.rowCount(), merged.rowCount(), fresh.rowCount());
        return new SheetMergeOutcome(sheetName, merged, base.rowCount(), merged.rowCount() - base.rowCount());
    }
}
