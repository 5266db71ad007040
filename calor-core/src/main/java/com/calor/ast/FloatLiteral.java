package com.calor.ast;

public record FloatLiteral(
    TextSpan span,
    double value
) implements Expression {

    @Override
    public String type() {
        return "FloatLiteral";
    }
}
