package com.example.workbookmerge.service.yield;

import com.example.workbookmerge.service.FailureKind;
import com.example.workbookmerge.service.MergeStage;
import com.example.workbookmerge.service.Table;
import com.example.workbookmerge.service.WorkbookMergeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Adds computed ratio columns to a table. Any result that is not a finite number
 * (division by zero, missing or non-numeric operand) is stored as {@code 0.0}.
 */
@Component
public class YieldCalculator {

    private static final Logger logger = LoggerFactory.getLogger(YieldCalculator.class);

    public Table apply(Table table, List<YieldColumnSpec> specs) {
        Table result = table;
        for (YieldColumnSpec spec : specs) {
            result = result.withColumn(spec.column(), computeColumn(result, spec));
        }
        return result;
    }

    List<Object> computeColumn(Table table, YieldColumnSpec spec) {
        if (spec.column() == null || spec.column().isBlank() || spec.mode() == null) {
            throw new WorkbookMergeException(MergeStage.YIELD, FailureKind.INVALID_EXPRESSION,
                    "Yield column needs a name and a mode: " + spec);
        }
        switch (spec.mode()) {
            case CONSTANT:
                double constant = finiteOrZero(parseConstant(spec));
                logger.info("Set {} to constant {} for {} rows", spec.column(), constant, table.rowCount());
                return new ArrayList<>(Collections.nCopies(table.rowCount(), constant));
            case COPY_COLUMN:
                return copyColumn(table, spec);
            default:
                return evaluate(table, spec);
        }
    }

    private List<Object> copyColumn(Table table, YieldColumnSpec spec) {
        String source = spec.argument();
        if (!table.hasColumn(source)) {
            logger.warn("Column '{}' missing for {}; setting {} to 0.0 for all rows",
                    source, spec.column(), spec.column());
            return new ArrayList<>(Collections.nCopies(table.rowCount(), 0.0));
        }
        List<Object> values = new ArrayList<>(table.rowCount());
        for (int r = 0; r < table.rowCount(); r++) {
            values.add(table.value(r, source));
        }
        logger.info("Copied {} values from column '{}'", spec.column(), source);
        return values;
    }

    private List<Object> evaluate(Table table, YieldColumnSpec spec) {
        Expression expression = ExpressionParser.parse(spec.argument());
        Set<String> missing = expression.referencedColumns();
        missing.removeAll(table.columns());
        if (!missing.isEmpty()) {
            logger.warn("Required columns missing for {} calculation: {}. Setting {} to 0.0 for all rows",
                    spec.column(), missing, spec.column());
        }

        List<Object> values = new ArrayList<>(table.rowCount());
        for (int r = 0; r < table.rowCount(); r++) {
            final int row = r;
            double value = expression.evaluate(column ->
                    table.hasColumn(column) ? toNumber(table.value(row, column)) : Double.NaN);
            values.add(finiteOrZero(value));
        }
        logger.info("Calculated {} as {}", spec.column(), spec.argument());
        return values;
    }

    private double parseConstant(YieldColumnSpec spec) {
        String argument = spec.argument();
        if (argument == null || argument.isBlank()) {
            return 0.0;
        }
        try {
            return Double.parseDouble(argument.trim());
        } catch (NumberFormatException e) {
            throw new WorkbookMergeException(MergeStage.YIELD, FailureKind.INVALID_EXPRESSION,
                    "Constant for " + spec.column() + " is not a number: " + argument, e);
        }
    }

    static double toNumber(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim().replace(",", ""));
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    private static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
