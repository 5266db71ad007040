package com.calor.ast;

public record NoneExpression(
    TextSpan span,
    String typeName  // Can be null
) implements Expression {

    @Override
    public String type() {
        return "NoneExpression";
    }
}
