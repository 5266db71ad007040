package com.calor.ast;

public record TypeOfExpression(
    TextSpan span,
    String typeName
) implements Expression {

    @Override
    public String type() {
        return "TypeOfExpression";
    }
}
