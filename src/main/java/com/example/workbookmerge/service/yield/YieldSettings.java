package com.example.workbookmerge.service.yield;

import java.util.List;

/**
 * Which sheet receives yield columns and how each column is computed.
 * Loaded from {@code yield-config.json} on the classpath.
 */
public record YieldSettings(
        String targetSheet,
        List<YieldColumnSpec> columns
) {
    public static final String DEFAULT_TARGET_SHEET = "Sheet1";

    public YieldSettings {
        targetSheet = targetSheet == null || targetSheet.isBlank() ? DEFAULT_TARGET_SHEET : targetSheet;
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public static YieldSettings defaults() {
        return new YieldSettings(DEFAULT_TARGET_SHEET, List.of(
                YieldColumnSpec.expression("e_yield", "Data 2 / Data 3"),
                YieldColumnSpec.expression("asm_yield", "Data 1 / Data 2")
        ));
    }
}
