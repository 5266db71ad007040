package com.calor.ast;

public record ThisExpression(
    TextSpan span
) implements Expression {

    @Override
    public String type() {
        return "ThisExpression";
    }
}
