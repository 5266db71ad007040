package com.calor;

import com.calor.ast.TextSpan;

/**
 * A lexical token. {@code value} holds the decoded literal (Integer, Double, BigDecimal,
 * Boolean or String) for literal tokens and is null otherwise.
 */
public record Token(TokenType type, String text, Object value, TextSpan span) {

    public Token(TokenType type, String text, TextSpan span) {
        this(type, text, null, span);
    }

    public int line() {
        return span.line();
    }

    public int column() {
        return span.column();
    }
}
