package com.example.workbookmerge.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Brings two tables onto one schema: the sorted union of their columns, with
 * {@code null} in every column a table did not have.
 */
@Component
public class ColumnAligner {

    private static final Logger logger = LoggerFactory.getLogger(ColumnAligner.class);

    public AlignedTables align(Table base, Table incoming) {
        TreeSet<String> union = new TreeSet<>(base.columns());
        union.addAll(incoming.columns());
        List<String> allColumns = new ArrayList<>(union);

        logMissing("base", base, allColumns);
        logMissing("incoming", incoming, allColumns);

        return new AlignedTables(base.project(allColumns), incoming.project(allColumns));
    }

    private void logMissing(String side, Table table, List<String> allColumns) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        for (String column : allColumns) {
            if (!table.hasColumn(column)) {
                logger.debug("Added missing column '{}' to {} table", column, side);
            }
        }
    }
}
