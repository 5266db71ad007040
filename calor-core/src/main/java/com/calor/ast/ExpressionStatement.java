package com.calor.ast;

public record ExpressionStatement(
    TextSpan span,
    Expression expression
) implements Statement {

    @Override
    public String type() {
        return "ExpressionStatement";
    }
}
