package com.example.workbookmerge.service.yield;

import java.util.List;

public record YieldReport(
        String sheetName,
        int rowCount,
        List<String> columnsAdded,
        List<String> preservedSheets,
        String outputPath,
        String backupPath
) {
}
