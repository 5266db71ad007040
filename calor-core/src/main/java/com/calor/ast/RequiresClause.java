package com.calor.ast;

public record RequiresClause(
    TextSpan span,
    Expression condition,
    String message  // Can be null
) implements Node {

    @Override
    public String type() {
        return "RequiresClause";
    }
}
