package com.calor.ast;

public record SomePattern(
    TextSpan span,
    Pattern inner
) implements Pattern {

    @Override
    public String type() {
        return "SomePattern";
    }
}
