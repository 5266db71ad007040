package com.calor.ast;

public record LambdaParameter(
    TextSpan span,
    String name,
    String typeName  // Can be null
) implements Node {

    @Override
    public String type() {
        return "LambdaParameter";
    }
}
