package com.example.workbookmerge.service;

import java.util.List;

public record MergeReport(
        MergeMode mode,
        List<String> sheetNames,
        List<SheetStats> sheetStats,
        List<String> passThroughSheets,
        List<String> droppedIncomingSheets,
        int totalOriginalRows,
        int totalFinalRows,
        int totalRowsAdded,
        boolean noOp,
        boolean saved,
        String outputPath,
        String backupPath
) {
}
