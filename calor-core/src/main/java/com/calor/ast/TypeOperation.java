package com.calor.ast;

public record TypeOperation(
    TextSpan span,
    TypeOp operation,
    Expression operand,
    String targetType
) implements Expression {

    @Override
    public String type() {
        return "TypeOperation";
    }
}
