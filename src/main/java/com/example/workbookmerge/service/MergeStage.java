package com.example.workbookmerge.service;

public enum MergeStage {
    RESOLVE,
    ALIGN,
    DETECT,
    MERGE,
    PERSIST,
    YIELD
}
