package com.example.workbookmerge.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges every sheet two workbooks share and copies through the sheets only the base
 * workbook has. Sheets only the incoming workbook has are not carried over.
 * <p>
 * When no sheet names match, the first sheet of each workbook is merged instead and the
 * result holds that single sheet, under the base sheet's name.
 */
@Service
@RequiredArgsConstructor
public class WorkbookMergeOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookMergeOrchestrator.class);

    private final SheetCatalog sheetCatalog;
    private final SheetMerger sheetMerger;

    public MergeResult mergeWorkbooks(TableWorkbook base, TableWorkbook incoming) {
        SheetResolution resolution = sheetCatalog.resolve(base.sheetNames(), incoming.sheetNames());
        if (!resolution.hasCommonSheets()) {
            return mergeFirstSheets(base, incoming);
        }

        Map<String, Table> output = new LinkedHashMap<>();
        List<SheetStats> stats = new ArrayList<>();
        List<String> passThrough = new ArrayList<>();
        // base order drives the output order, merged and copied sheets interleaved
        for (String name : base.sheetNames()) {
            if (resolution.common().contains(name)) {
                SheetMergeOutcome outcome = mergeSheet(name, base.sheet(name), incoming.sheet(name));
                output.put(name, outcome.merged());
                stats.add(outcome.stats());
            } else {
                output.put(name, base.sheet(name));
                passThrough.add(name);
                logger.info("Copied sheet '{}' from base workbook (no matching sheet in incoming)", name);
            }
        }

        if (!resolution.incomingOnly().isEmpty()) {
            logger.warn("Incoming sheets without a match in base were not merged: {}", resolution.incomingOnly());
        }

        MergeResult result = new MergeResult(TableWorkbook.of(output), stats, MergeMode.SHEET_MATCH,
                passThrough, resolution.incomingOnly());
        logger.info("Multi-sheet merge completed. Sheets merged: {}, total new rows added: {}",
                stats.size(), result.totalRowsAdded());
        return result;
    }

    private MergeResult mergeFirstSheets(TableWorkbook base, TableWorkbook incoming) {
        String baseSheet = base.firstSheetName().orElseThrow(() -> new WorkbookMergeException(
                MergeStage.RESOLVE, FailureKind.SOURCE_UNREADABLE, "Base workbook has no sheets"));
        String incomingSheet = incoming.firstSheetName().orElseThrow(() -> new WorkbookMergeException(
                MergeStage.RESOLVE, FailureKind.SOURCE_UNREADABLE, "Incoming workbook has no sheets"));

        logger.warn("No common sheet names found. Merging first sheet '{}' of incoming into first sheet '{}' of base",
                incomingSheet, baseSheet);
        SheetMergeOutcome outcome = mergeSheet(baseSheet, base.sheet(baseSheet), incoming.sheet(incomingSheet));

        List<String> omitted = base.sheetNames().subList(1, base.sheetCount());
        if (!omitted.isEmpty()) {
            logger.warn("Fallback result only holds sheet '{}'; base sheets left out: {}", baseSheet, omitted);
        }
        List<String> dropped = incoming.sheetNames().subList(1, incoming.sheetCount());
        return new MergeResult(TableWorkbook.single(baseSheet, outcome.merged()), List.of(outcome.stats()),
                MergeMode.FIRST_SHEET_FALLBACK, List.of(), dropped);
    }

    private SheetMergeOutcome mergeSheet(String name, Table base, Table incoming) {
        try {
            return sheetMerger.mergeSheet(name, base, incoming);
        } catch (WorkbookMergeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new WorkbookMergeException(MergeStage.MERGE, FailureKind.INTERNAL_ERROR,
                    "Merging sheet '" + name + "' failed: " + e.getMessage(), e);
        }
    }
}
