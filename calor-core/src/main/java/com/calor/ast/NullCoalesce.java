package com.calor.ast;

public record NullCoalesce(
    TextSpan span,
    Expression left,
    Expression right
) implements Expression {

    @Override
    public String type() {
        return "NullCoalesce";
    }
}
