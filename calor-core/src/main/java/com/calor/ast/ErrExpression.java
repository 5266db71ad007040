package com.calor.ast;

public record ErrExpression(
    TextSpan span,
    Expression error
) implements Expression {

    @Override
    public String type() {
        return "ErrExpression";
    }
}
