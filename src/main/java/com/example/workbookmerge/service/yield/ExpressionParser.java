package com.example.workbookmerge.service.yield;

import com.example.workbookmerge.service.FailureKind;
import com.example.workbookmerge.service.MergeStage;
import com.example.workbookmerge.service.WorkbookMergeException;

/**
 * Recursive-descent parser for yield formulas.
 * <pre>
 * expr   := term (('+' | '-') term)*
 * term   := factor (('*' | '/') factor)*
 * factor := '-' factor | number | column | '(' expr ')'
 * column := bare name (letters, digits, '_', '.', inner spaces) | `quoted` | "quoted"
 * </pre>
 * Bare column names may contain spaces, so {@code Data 2 / Data 3} reads as two columns.
 */
public final class ExpressionParser {

    private final String source;
    private int pos;

    private ExpressionParser(String source) {
        this.source = source;
    }

    public static Expression parse(String formula) {
        if (formula == null || formula.isBlank()) {
            throw invalid(formula, "formula is empty");
        }
        ExpressionParser parser = new ExpressionParser(formula);
        Expression expression = parser.parseExpression();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw invalid(formula, "unexpected '" + parser.peek() + "' at position " + parser.pos);
        }
        return expression;
    }

    private Expression parseExpression() {
        Expression left = parseTerm();
        while (true) {
            skipWhitespace();
            if (consume('+')) {
                left = new Expression.Binary(Expression.Operator.ADD, left, parseTerm());
            } else if (consume('-')) {
                left = new Expression.Binary(Expression.Operator.SUBTRACT, left, parseTerm());
            } else {
                return left;
            }
        }
    }

    private Expression parseTerm() {
        Expression left = parseFactor();
        while (true) {
            skipWhitespace();
            if (consume('*')) {
                left = new Expression.Binary(Expression.Operator.MULTIPLY, left, parseFactor());
            } else if (consume('/')) {
                left = new Expression.Binary(Expression.Operator.DIVIDE, left, parseFactor());
            } else {
                return left;
            }
        }
    }

    private Expression parseFactor() {
        skipWhitespace();
        if (atEnd()) {
            throw invalid(source, "unexpected end of formula");
        }
        char c = peek();
        if (consume('-')) {
            return new Expression.Negate(parseFactor());
        }
        if (consume('(')) {
            Expression inner = parseExpression();
            skipWhitespace();
            if (!consume(')')) {
                throw invalid(source, "missing ')' at position " + pos);
            }
            return inner;
        }
        if (c == '`' || c == '"') {
            return new Expression.ColumnRef(parseQuoted(c));
        }
        if (Character.isDigit(c) || c == '.') {
            return new Expression.Constant(parseNumber());
        }
        if (Character.isLetter(c) || c == '_') {
            return new Expression.ColumnRef(parseBareName());
        }
        throw invalid(source, "unexpected '" + c + "' at position " + pos);
    }

    private double parseNumber() {
        int start = pos;
        while (!atEnd() && (Character.isDigit(peek()) || peek() == '.')) {
            pos++;
        }
        if (!atEnd() && (peek() == 'e' || peek() == 'E')) {
            int mark = pos;
            pos++;
            if (!atEnd() && (peek() == '+' || peek() == '-')) {
                pos++;
            }
            if (atEnd() || !Character.isDigit(peek())) {
                pos = mark;
            } else {
                while (!atEnd() && Character.isDigit(peek())) {
                    pos++;
                }
            }
        }
        String text = source.substring(start, pos);
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw invalid(source, "bad number '" + text + "'");
        }
    }

    private String parseBareName() {
        int start = pos;
        while (!atEnd() && isNameChar(peek())) {
            pos++;
        }
        String name = source.substring(start, pos).trim();
        // trailing spaces belong to the surrounding whitespace, not the name
        pos = start + source.substring(start, pos).stripTrailing().length();
        return name;
    }

    private String parseQuoted(char quote) {
        pos++;
        int start = pos;
        while (!atEnd() && peek() != quote) {
            pos++;
        }
        if (atEnd()) {
            throw invalid(source, "unterminated " + quote + " quote");
        }
        String name = source.substring(start, pos);
        pos++;
        if (name.isBlank()) {
            throw invalid(source, "empty column name");
        }
        return name;
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == ' ';
    }

    private boolean consume(char expected) {
        if (!atEnd() && peek() == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(peek())) {
            pos++;
        }
    }

    private boolean atEnd() {
        return pos >= source.length();
    }

    private char peek() {
        return source.charAt(pos);
    }

    private static WorkbookMergeException invalid(String formula, String reason) {
        return new WorkbookMergeException(MergeStage.YIELD, FailureKind.INVALID_EXPRESSION,
                "Invalid formula '" + formula + "': " + reason);
    }
}
