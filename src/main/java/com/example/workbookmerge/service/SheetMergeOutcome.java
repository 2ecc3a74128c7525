package com.example.workbookmerge.service;

public record SheetMergeOutcome(
        String sheetName,
        Table merged,
        int originalRowCount,
        int rowsAdded
) {
    public boolean isNoOp() {
        return rowsAdded == 0;
    }

    public SheetStats stats() {
        return new SheetStats(sheetName, originalRowCount, merged.rowCount(), rowsAdded);
    }
}
