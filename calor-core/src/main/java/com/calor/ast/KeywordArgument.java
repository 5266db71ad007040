package com.calor.ast;

public record KeywordArgument(
    TextSpan span,
    String name
) implements Expression {

    @Override
    public String type() {
        return "KeywordArgument";
    }
}
