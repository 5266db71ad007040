package com.calor.ast;

public record VariablePattern(
    TextSpan span,
    String name
) implements Pattern {

    @Override
    public String type() {
        return "VariablePattern";
    }
}
