package com.calor.ast;

public record UnaryOperation(
    TextSpan span,
    UnaryOperator operator,
    Expression operand
) implements Expression {

    @Override
    public String type() {
        return "UnaryOperation";
    }
}
