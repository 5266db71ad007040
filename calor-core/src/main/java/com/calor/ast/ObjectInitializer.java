package com.calor.ast;

public record ObjectInitializer(
    TextSpan span,
    String name,
    Expression value
) implements Node {

    @Override
    public String type() {
        return "ObjectInitializer";
    }
}
