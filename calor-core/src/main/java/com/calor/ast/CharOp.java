package com.calor.ast;

public enum CharOp {
    CHAR_AT("char-at", 2, 2),
    CHAR_CODE("char-code", 1, 1),
    CHAR_FROM_CODE("char-from-code", 1, 1),
    IS_LETTER("is-letter", 1, 1),
    IS_DIGIT("is-digit", 1, 1),
    IS_WHITESPACE("is-whitespace", 1, 1),
    IS_UPPER("is-upper", 1, 1),
    IS_LOWER("is-lower", 1, 1),
    TO_UPPER("char-upper", 1, 1),
    TO_LOWER("char-lower", 1, 1),
    CHAR_LITERAL("char-lit", 1, 1);

    private final String keyword;
    private final int minArgs;
    private final int maxArgs;

    CharOp(String keyword, int minArgs, int maxArgs) {
        this.keyword = keyword;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    public String keyword() {
        return keyword;
    }

    public int minArgs() {
        return minArgs;
    }

    public int maxArgs() {
        return maxArgs;
    }

    public static CharOp fromString(String text) {
        for (CharOp op : values()) {
            if (op.keyword.equals(text)) {
                return op;
            }
        }
        return null;
    }
}
