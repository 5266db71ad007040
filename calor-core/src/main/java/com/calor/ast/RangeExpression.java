package com.calor.ast;

public record RangeExpression(
    TextSpan span,
    Expression start,  // Can be null
    Expression end  // Can be null
) implements Expression {

    @Override
    public String type() {
        return "RangeExpression";
    }
}
