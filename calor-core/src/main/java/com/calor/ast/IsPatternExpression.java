package com.calor.ast;

public record IsPatternExpression(
    TextSpan span,
    Expression operand,
    String typeName,
    String variableName  // Can be null
) implements Expression {

    @Override
    public String type() {
        return "IsPatternExpression";
    }
}
