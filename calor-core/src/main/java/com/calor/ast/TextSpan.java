package com.calor.ast;

/**
 * Source range of a token or node. Lines and columns are 1-based; {@code start} and
 * {@code length} are character offsets into the source text.
 */
public record TextSpan(int start, int length, int line, int column) {

    public static final TextSpan EMPTY = new TextSpan(0, 0, 1, 1);

    public int end() {
        return start + length;
    }

    /**
     * Smallest span covering both this span and {@code other}. The line and column come
     * from whichever span starts first.
     */
    public TextSpan union(TextSpan other) {
        if (other == null) {
            return this;
        }
        TextSpan first = other.start < start ? other : this;
        int newStart = Math.min(start, other.start);
        int newEnd = Math.max(end(), other.end());
        return new TextSpan(newStart, newEnd - newStart, first.line, first.column);
    }
}
