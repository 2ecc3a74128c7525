package com.example.workbookmerge.service.yield;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Parsed yield formula. Evaluation reads column values through {@code columns}, which
 * returns {@link Double#NaN} for a missing or non-numeric operand.
 */
public interface Expression {

    double evaluate(ToDoubleFunction<String> columns);

    default Set<String> referencedColumns() {
        Set<String> names = new LinkedHashSet<>();
        collectColumns(names);
        return names;
    }

    void collectColumns(Set<String> names);

    record Constant(double value) implements Expression {
        @Override
        public double evaluate(ToDoubleFunction<String> columns) {
            return value;
        }

        @Override
        public void collectColumns(Set<String> names) {
        }
    }

    record ColumnRef(String column) implements Expression {
        @Override
        public double evaluate(ToDoubleFunction<String> columns) {
            return columns.applyAsDouble(column);
        }

        @Override
        public void collectColumns(Set<String> names) {
            names.add(column);
        }
    }

    record Negate(Expression operand) implements Expression {
        @Override
        public double evaluate(ToDoubleFunction<String> columns) {
            return -operand.evaluate(columns);
        }

        @Override
        public void collectColumns(Set<String> names) {
            operand.collectColumns(names);
        }
    }

    record Binary(Operator operator, Expression left, Expression right) implements Expression {
        @Override
        public double evaluate(ToDoubleFunction<String> columns) {
            return operator.apply(left.evaluate(columns), right.evaluate(columns));
        }

        @Override
        public void collectColumns(Set<String> names) {
            left.collectColumns(names);
            right.collectColumns(names);
        }
    }

    enum Operator {
        ADD,
        SUBTRACT,
        MULTIPLY,
        DIVIDE;

        public double apply(double left, double right) {
            switch (this) {
                case ADD:
                    return left + right;
                case SUBTRACT:
                    return left - right;
                case MULTIPLY:
                    return left * right;
                case DIVIDE:
                    return left / right;
                default:
                    throw new IllegalStateException("Unsupported operator: " + this);
            }
        }
    }
}
