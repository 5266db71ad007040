package com.calor.ast;

public record ReturnStatement(
    TextSpan span,
    Expression expression  // Can be null
) implements Statement {

    @Override
    public String type() {
        return "ReturnStatement";
    }
}
