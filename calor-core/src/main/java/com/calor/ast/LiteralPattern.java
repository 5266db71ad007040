package com.calor.ast;

public record LiteralPattern(
    TextSpan span,
    Expression literal
) implements Pattern {

    @Override
    public String type() {
        return "LiteralPattern";
    }
}
