package com.calor.ast;

public record ContinueStatement(
    TextSpan span
) implements Statement {

    @Override
    public String type() {
        return "ContinueStatement";
    }
}
