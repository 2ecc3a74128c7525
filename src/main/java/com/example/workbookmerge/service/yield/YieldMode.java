package com.example.workbookmerge.service.yield;

public enum YieldMode {
    CONSTANT,
    COPY_COLUMN,
    EXPRESSION
}
