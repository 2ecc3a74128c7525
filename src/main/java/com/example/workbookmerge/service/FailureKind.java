package com.example.workbookmerge.service;

public enum FailureKind {
    SOURCE_UNREADABLE,   // workbook missing, corrupt, or without sheets
    BACKUP_FAILURE,      // nothing written to the target
    WRITE_FAILURE,       // backup already on disk
    INVALID_EXPRESSION,
    INTERNAL_ERROR
}
