package com.calor.ast;

public record RelationalPattern(
    TextSpan span,
    String operator,
    Expression value
) implements Pattern {

    @Override
    public String type() {
        return "RelationalPattern";
    }
}
