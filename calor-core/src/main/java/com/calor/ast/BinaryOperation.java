package com.calor.ast;

public record BinaryOperation(
    TextSpan span,
    BinaryOperator operator,
    Expression left,
    Expression right
) implements Expression {

    @Override
    public String type() {
        return "BinaryOperation";
    }
}
