package com.calor.ast;

public record ThrowStatement(
    TextSpan span,
    Expression exception  // Can be null
) implements Statement {

    @Override
    public String type() {
        return "ThrowStatement";
    }
}
