package com.example.workbookmerge.service;

import java.util.List;

/**
 * Output of {@link WorkbookMergeOrchestrator#mergeWorkbooks}. {@code sheetStats} only
 * lists sheets that went through a merge; pass-through sheets have none.
 */
public record MergeResult(
        TableWorkbook merged,
        List<SheetStats> sheetStats,
        MergeMode mode,
        List<String> passThroughSheets,
        List<String> droppedIncomingSheets
) {
    public MergeResult {
        sheetStats = List.copyOf(sheetStats);
        passThroughSheets = List.copyOf(passThroughSheets);
        droppedIncomingSheets = List.copyOf(droppedIncomingSheets);
    }

    public int totalOriginalRows() {
        return sheetStats.stream().mapToInt(SheetStats::originalRowCount).sum();
    }

    public int totalFinalRows() {
        return sheetStats.stream().mapToInt(SheetStats::finalRowCount).sum();
    }

    public int totalRowsAdded() {
        return sheetStats.stream().mapToInt(SheetStats::rowsAdded).sum();
    }

    public boolean isNoOp() {
        return totalRowsAdded() == 0;
    }
}
