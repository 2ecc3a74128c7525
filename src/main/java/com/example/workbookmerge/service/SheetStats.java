package com.example.workbookmerge.service;

public record SheetStats(
        String sheetName,
        int originalRowCount,
        int finalRowCount,
        int rowsAdded
) {
}
