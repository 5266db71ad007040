package com.calor.ast;

/**
 * String operators available in prefix expressions, with their argument-count contract.
 * {@code substr} resolves to {@link #SUBSTRING}; the parser narrows it to
 * {@link #SUBSTRING_FROM} when only two arguments are given.
 */
public enum StringOp {
    LENGTH("len", 1, 1),
    TO_UPPER("upper", 1, 1),
    TO_LOWER("lower", 1, 1),
    TRIM("trim", 1, 1),
    TRIM_START("ltrim", 1, 1),
    TRIM_END("rtrim", 1, 1),
    IS_NULL_OR_EMPTY("isempty", 1, 1),
    IS_NULL_OR_WHITESPACE("isblank", 1, 1),
    TO_STRING("str", 1, 1),
    CONTAINS("contains", 2, 2),
    STARTS_WITH("starts", 2, 2),
    ENDS_WITH("ends", 2, 2),
    INDEX_OF("indexof", 2, 2),
    EQUALS("equals", 2, 2),
    SPLIT("split", 2, 2),
    JOIN("join", 2, 2),
    REGEX_TEST("regex-test", 2, 2),
    REGEX_MATCH("regex-match", 2, 2),
    REGEX_SPLIT("regex-split", 2, 2),
    PAD_LEFT("lpad", 2, 3),
    PAD_RIGHT("rpad", 2, 3),
    SUBSTRING("substr", 3, 3),
    SUBSTRING_FROM("substr", 2, 2),
    REPLACE("replace", 3, 3),
    REGEX_REPLACE("regex-replace", 3, 3),
    CONCAT("concat", 2, Integer.MAX_VALUE),
    FORMAT("fmt", 2, Integer.MAX_VALUE);

    private final String keyword;
    private final int minArgs;
    private final int maxArgs;

    StringOp(String keyword, int minArgs, int maxArgs) {
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

    public boolean supportsComparisonMode() {
        return this == CONTAINS || this == STARTS_WITH || this == ENDS_WITH
            || this == INDEX_OF || this == EQUALS;
    }

    public static StringOp fromString(String text) {
        if (text == null) {
            return null;
        }
        if (text.equals("substr")) {
            return SUBSTRING;
        }
        for (StringOp op : values()) {
            if (op.keyword.equals(text)) {
                return op;
            }
        }
        return null;
    }
}
