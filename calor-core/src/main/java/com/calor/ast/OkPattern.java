package com.calor.ast;

public record OkPattern(
    TextSpan span,
    Pattern inner
) implements Pattern {

    @Override
    public String type() {
        return "OkPattern";
    }
}
