package com.calor.ast;

public record BaseExpression(
    TextSpan span
) implements Expression {

    @Override
    public String type() {
        return "BaseExpression";
    }
}
