package com.calor.ast;

import java.util.Locale;

public enum UnaryOperator {
    NOT,
    BITWISE_NOT,
    NEGATE,
    PRE_INCREMENT,
    PRE_DECREMENT,
    POST_INCREMENT,
    POST_DECREMENT;

    public static UnaryOperator fromString(String text) {
        if (text == null) {
            return null;
        }
        return switch (text.toLowerCase(Locale.ROOT)) {
            case "!", "not" -> NOT;
            case "~", "bnot", "bitwisenot" -> BITWISE_NOT;
            case "-", "neg", "negate" -> NEGATE;
            case "++", "inc", "pre-inc" -> PRE_INCREMENT;
            case "--", "dec", "pre-dec" -> PRE_DECREMENT;
            case "post-inc" -> POST_INCREMENT;
            case "post-dec" -> POST_DECREMENT;
            default -> null;
        };
    }
}
