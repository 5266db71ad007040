package com.calor.ast;

public record ErrPattern(
    TextSpan span,
    Pattern inner
) implements Pattern {

    @Override
    public String type() {
        return "ErrPattern";
    }
}
