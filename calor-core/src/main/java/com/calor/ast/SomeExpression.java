package com.calor.ast;

public record SomeExpression(
    TextSpan span,
    Expression value
) implements Expression {

    @Override
    public String type() {
        return "SomeExpression";
    }
}
