package com.calor.ast;

public record EnsuresClause(
    TextSpan span,
    Expression condition,
    String message  // Can be null
) implements Node {

    @Override
    public String type() {
        return "EnsuresClause";
    }
}
