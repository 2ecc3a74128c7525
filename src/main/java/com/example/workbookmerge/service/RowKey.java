package com.example.workbookmerge.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Exact fingerprint of one row: its cells in column order, each in canonical text form.
 */
public record RowKey(List<String> cells) {

    public RowKey {
        cells = List.copyOf(cells);
    }

    public static RowKey of(List<?> row) {
        List<String> cells = new ArrayList<>(row.size());
        for (Object value : row) {
            cells.add(CellValues.canonical(value));
        }
        return new RowKey(cells);
    }
}
