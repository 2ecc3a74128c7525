package com.example.workbookmerge.service.yield;

/**
 * One computed output column.
 *
 * @param column   name of the column to add or replace
 * @param mode     how values are produced
 * @param argument number for {@code CONSTANT}, source column for {@code COPY_COLUMN},
 *                 formula for {@code EXPRESSION}
 */
public record YieldColumnSpec(
        String column,
        YieldMode mode,
        String argument
) {
    public static YieldColumnSpec constant(String column, double value) {
        return new YieldColumnSpec(column, YieldMode.CONSTANT, Double.toString(value));
    }

    public static YieldColumnSpec copyColumn(String column, String sourceColumn) {
        return new YieldColumnSpec(column, YieldMode.COPY_COLUMN, sourceColumn);
    }

    public static YieldColumnSpec expression(String column, String formula) {
        return new YieldColumnSpec(column, YieldMode.EXPRESSION, formula);
    }
}
