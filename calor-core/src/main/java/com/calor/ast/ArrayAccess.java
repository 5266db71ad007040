package com.calor.ast;

public record ArrayAccess(
    TextSpan span,
    Expression array,
    Expression index
) implements Expression {

    @Override
    public String type() {
        return "ArrayAccess";
    }
}
