package com.example.workbookmerge.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Immutable sheet contents: ordered column names and ordered rows.
 * Each row holds one cell per column, in column order. A cell is a {@link String},
 * {@link Double}, {@link Boolean}, {@link java.time.LocalDateTime} or {@code null}.
 */
public final class Table {

    private final List<String> columns;
    private final List<List<Object>> rows;

    private Table(List<String> columns, List<List<Object>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public static Table of(List<String> columns, List<? extends List<?>> rows) {
        Objects.requireNonNull(columns, "columns");
        Objects.requireNonNull(rows, "rows");
        List<String> cols = List.copyOf(columns);
        if (new HashSet<>(cols).size() != cols.size()) {
            throw new IllegalArgumentException("Duplicate column names: " + cols);
        }
        List<List<Object>> copied = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            List<?> row = rows.get(r);
            if (row.size() != cols.size()) {
                throw new IllegalArgumentException("Row " + r + " has " + row.size()
                        + " cells but the table has " + cols.size() + " columns");
            }
            copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        return new Table(cols, Collections.unmodifiableList(copied));
    }

    public static Table empty(List<String> columns) {
        return of(columns, List.of());
    }

    public List<String> columns() {
        return columns;
    }

    public List<List<Object>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<Object> row(int index) {
        return rows.get(index);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int columnIndex(String column) {
        return columns.indexOf(column);
    }

    public Object value(int rowIndex, String column) {
        int c = columnIndex(column);
        if (c < 0) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return rows.get(rowIndex).get(c);
    }

    /**
     * Returns a copy laid out in {@code targetColumns} order. Columns this table lacks are
     * filled with {@code null}; columns not listed are dropped.
     */
    public Table project(List<String> targetColumns) {
        int[] sourceIndexes = new int[targetColumns.size()];
        for (int i = 0; i < targetColumns.size(); i++) {
            sourceIndexes[i] = columnIndex(targetColumns.get(i));
        }
        List<List<Object>> projected = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            List<Object> values = new ArrayList<>(sourceIndexes.length);
            for (int idx : sourceIndexes) {
                values.add(idx < 0 ? null : row.get(idx));
            }
            projected.add(values);
        }
        return of(targetColumns, projected);
    }

    /**
     * Returns a copy with {@code extra} appended after the existing rows.
     * The extra rows must already be laid out in this table's column order.
     */
    public Table appendRows(List<? extends List<?>> extra) {
        List<List<Object>> combined = new ArrayList<>(rows.size() + extra.size());
        combined.addAll(rows);
        for (List<?> row : extra) {
            combined.add(new ArrayList<>(row));
        }
        return of(columns, combined);
    }

    /**
     * Returns a copy with the given column set to {@code values}; an existing column
     * keeps its position, a new one is appended last.
     */
    public Table withColumn(String column, List<?> values) {
        if (values.size() != rows.size()) {
            throw new IllegalArgumentException("Column " + column + " has " + values.size()
                    + " values but the table has " + rows.size() + " rows");
        }
        int existing = columnIndex(column);
        List<String> cols = new ArrayList<>(columns);
        if (existing < 0) {
            cols.add(column);
        }
        List<List<Object>> updated = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            List<Object> row = new ArrayList<>(rows.get(r));
            if (existing < 0) {
                row.add(values.get(r));
            } else {
                row.set(existing, values.get(r));
            }
            updated.add(row);
        }
        return of(cols, updated);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Table)) {
            return false;
        }
        Table other = (Table) o;
        return columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "Table" + columns + " x " + rows.size() + " rows";
    }
}
