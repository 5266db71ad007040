package com.calor.ast;

public record RethrowStatement(
    TextSpan span
) implements Statement {

    @Override
    public String type() {
        return "RethrowStatement";
    }
}
