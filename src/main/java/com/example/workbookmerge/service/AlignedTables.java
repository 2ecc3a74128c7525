package com.example.workbookmerge.service;

public record AlignedTables(Table base, Table incoming) {
}
