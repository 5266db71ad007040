package com.calor.ast;

public record VarPattern(
    TextSpan span,
    String name
) implements Pattern {

    @Override
    public String type() {
        return "VarPattern";
    }
}
