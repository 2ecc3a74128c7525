package com.example.workbookmerge.service;

public enum MergeMode {
    SHEET_MATCH,          // sheets paired by name
    FIRST_SHEET_FALLBACK  // no shared names, first sheet of each workbook paired
}
