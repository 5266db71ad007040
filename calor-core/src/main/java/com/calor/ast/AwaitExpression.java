package com.calor.ast;

public record AwaitExpression(
    TextSpan span,
    Expression awaited,
    Boolean configureAwait  // Null when not specified
) implements Expression {

    @Override
    public String type() {
        return "AwaitExpression";
    }
}
