package com.calor.ast;

public record OkExpression(
    TextSpan span,
    Expression value
) implements Expression {

    @Override
    public String type() {
        return "OkExpression";
    }
}
