package com.calor.ast;

public record ConditionalExpression(
    TextSpan span,
    Expression condition,
    Expression whenTrue,
    Expression whenFalse
) implements Expression {

    @Override
    public String type() {
        return "ConditionalExpression";
    }
}
