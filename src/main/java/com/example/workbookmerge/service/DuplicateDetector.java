package com.example.workbookmerge.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the incoming rows that do not already exist in the base table.
 * Both tables must share the same column order (see {@link ColumnAligner}).
 */
@Component
public class DuplicateDetector {

    private static final Logger logger = LoggerFactory.getLogger(DuplicateDetector.class);

    public Table findNew(Table alignedBase, Table alignedIncoming) {
        if (!alignedBase.columns().equals(alignedIncoming.columns())) {
            throw new IllegalArgumentException("Tables are not column-aligned: "
                    + alignedBase.columns() + " vs " + alignedIncoming.columns());
        }

        Set<RowKey> baseKeys = new HashSet<>(alignedBase.rowCount() * 2);
        for (List<Object> row : alignedBase.rows()) {
            baseKeys.add(RowKey.of(row));
        }

        // Membership is checked against base rows only; repeats inside incoming are kept.
        List<List<Object>> fresh = new ArrayList<>();
        for (List<Object> row : alignedIncoming.rows()) {
            if (!baseKeys.contains(RowKey.of(row))) {
                fresh.add(row);
            }
        }

        int duplicates = alignedIncoming.rowCount() - fresh.size();
        logger.info("Found {} duplicate rows, {} unique rows to add", duplicates, fresh.size());
        return Table.of(alignedIncoming.columns(), fresh);
    }
}
