package com.calor.ast;

public record ArrayLength(
    TextSpan span,
    Expression array
) implements Expression {

    @Override
    public String type() {
        return "ArrayLength";
    }
}
