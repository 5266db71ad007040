package com.calor.ast;

public record StringLiteral(
    TextSpan span,
    String value,
    boolean multiline
) implements Expression {

    @Override
    public String type() {
        return "StringLiteral";
    }
}
