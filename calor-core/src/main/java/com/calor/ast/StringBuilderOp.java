package com.calor.ast;

public enum StringBuilderOp {
    NEW("sb-new", 0, 1),
    APPEND("sb-append", 2, 2),
    APPEND_LINE("sb-appendline", 1, 2),
    INSERT("sb-insert", 3, 3),
    REMOVE("sb-remove", 3, 3),
    CLEAR("sb-clear", 1, 1),
    TO_STRING("sb-tostring", 1, 1),
    LENGTH("sb-length", 1, 1);

    private final String keyword;
    private final int minArgs;
    private final int maxArgs;

    StringBuilderOp(String keyword, int minArgs, int maxArgs) {
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

    public static StringBuilderOp fromString(String text) {
        for (StringBuilderOp op : values()) {
            if (op.keyword.equals(text)) {
                return op;
            }
        }
        return null;
    }
}
