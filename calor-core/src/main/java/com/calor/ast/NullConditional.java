package com.calor.ast;

public record NullConditional(
    TextSpan span,
    Expression target,
    String memberName
) implements Expression {

    @Override
    public String type() {
        return "NullConditional";
    }
}
