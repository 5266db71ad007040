package com.calor.ast;

public record IndexFromEnd(
    TextSpan span,
    Expression offset
) implements Expression {

    @Override
    public String type() {
        return "IndexFromEnd";
    }
}
