package com.calor.ast;

public record BoolLiteral(
    TextSpan span,
    boolean value
) implements Expression {

    @Override
    public String type() {
        return "BoolLiteral";
    }
}
