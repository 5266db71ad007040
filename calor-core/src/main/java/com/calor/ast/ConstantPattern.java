package com.calor.ast;

public record ConstantPattern(
    TextSpan span,
    Expression value
) implements Pattern {

    @Override
    public String type() {
        return "ConstantPattern";
    }
}
