package com.calor.ast;

public record IntLiteral(
    TextSpan span,
    int value
) implements Expression {

    @Override
    public String type() {
        return "IntLiteral";
    }
}
