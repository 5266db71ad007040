package com.calor.ast;

public record NonePattern(
    TextSpan span
) implements Pattern {

    @Override
    public String type() {
        return "NonePattern";
    }
}
