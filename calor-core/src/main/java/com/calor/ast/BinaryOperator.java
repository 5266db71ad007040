package com.calor.ast;

import java.util.Locale;

public enum BinaryOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    MODULO("%"),
    POWER("**"),
    EQUAL("=="),
    NOT_EQUAL("!="),
    LESS_THAN("<"),
    LESS_OR_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_OR_EQUAL(">="),
    AND("&&"),
    OR("||"),
    BITWISE_AND("&"),
    BITWISE_OR("|"),
    BITWISE_XOR("^"),
    LEFT_SHIFT("<<"),
    RIGHT_SHIFT(">>");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Resolves a symbol or its word alias ({@code add}, {@code eq}, {@code lte}, ...).
     * Returns null when the text names no binary operator.
     */
    public static BinaryOperator fromString(String text) {
        if (text == null) {
            return null;
        }
        return switch (text.toLowerCase(Locale.ROOT)) {
            case "+", "add" -> ADD;
            case "-", "sub" -> SUBTRACT;
            case "*", "mul" -> MULTIPLY;
            case "/", "div" -> DIVIDE;
            case "%", "mod" -> MODULO;
            case "**", "pow" -> POWER;
            case "==", "eq" -> EQUAL;
            case "!=", "neq", "ne" -> NOT_EQUAL;
            case "<", "lt" -> LESS_THAN;
            case "<=", "lte", "le" -> LESS_OR_EQUAL;
            case ">", "gt" -> GREATER_THAN;
            case ">=", "gte", "ge" -> GREATER_OR_EQUAL;
            case "&&", "and" -> AND;
            case "||", "or" -> OR;
            case "&", "band" -> BITWISE_AND;
            case "|", "bor" -> BITWISE_OR;
            case "^", "bxor", "xor" -> BITWISE_XOR;
            case "<<", "shl" -> LEFT_SHIFT;
            case ">>", "shr" -> RIGHT_SHIFT;
            default -> null;
        };
    }
}
