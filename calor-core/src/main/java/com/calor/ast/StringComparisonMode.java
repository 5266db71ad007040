package com.calor.ast;

public enum StringComparisonMode {
    ORDINAL("ordinal"),
    IGNORE_CASE("ignore-case"),
    INVARIANT("invariant"),
    INVARIANT_IGNORE_CASE("invariant-ignore-case");

    private final String keyword;

    StringComparisonMode(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static StringComparisonMode fromKeyword(String keyword) {
        for (StringComparisonMode mode : values()) {
            if (mode.keyword.equals(keyword)) {
                return mode;
            }
        }
        return null;
    }
}
