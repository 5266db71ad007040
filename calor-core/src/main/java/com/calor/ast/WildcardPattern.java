package com.calor.ast;

public record WildcardPattern(
    TextSpan span
) implements Pattern {

    @Override
    public String type() {
        return "WildcardPattern";
    }
}
