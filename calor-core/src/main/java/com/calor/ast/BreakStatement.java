package com.calor.ast;

public record BreakStatement(
    TextSpan span
) implements Statement {

    @Override
    public String type() {
        return "BreakStatement";
    }
}
