package com.example.workbookmerge.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Sheet name to {@link Table}, in workbook order. Immutable.
 */
public final class TableWorkbook {

    private final Map<String, Table> sheets;

    private TableWorkbook(Map<String, Table> sheets) {
        this.sheets = sheets;
    }

    public static TableWorkbook of(Map<String, Table> sheets) {
        Objects.requireNonNull(sheets, "sheets");
        return new TableWorkbook(Collections.unmodifiableMap(new LinkedHashMap<>(sheets)));
    }

    public static TableWorkbook single(String sheetName, Table table) {
        Map<String, Table> map = new LinkedHashMap<>();
        map.put(sheetName, table);
        return of(map);
    }

    public List<String> sheetNames() {
        return new ArrayList<>(sheets.keySet());
    }

    public Map<String, Table> sheets() {
        return sheets;
    }

    public boolean hasSheet(String name) {
        return sheets.containsKey(name);
    }

    public Table sheet(String name) {
        Table table = sheets.get(name);
        if (table == null) {
            throw new IllegalArgumentException("No sheet named '" + name + "'");
        }
        return table;
    }

    public Optional<String> firstSheetName() {
        return sheets.keySet().stream().findFirst();
    }

    public int sheetCount() {
        return sheets.size();
    }

    public boolean isEmpty() {
        return sheets.isEmpty();
    }

    /**
     * Returns a copy with {@code name} set to {@code table}, keeping its position when
     * the sheet already exists.
     */
    public TableWorkbook withSheet(String name, Table table) {
        Map<String, Table> copy = new LinkedHashMap<>(sheets);
        copy.put(name, table);
        return of(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TableWorkbook)) {
            return false;
        }
        TableWorkbook other = (TableWorkbook) o;
        return sheetNames().equals(other.sheetNames()) && sheets.equals(other.sheets);
    }

    @Override
    public int hashCode() {
        return sheets.hashCode();
    }

    @Override
    public String toString() {
        return "TableWorkbook" + sheets.keySet();
    }
}
