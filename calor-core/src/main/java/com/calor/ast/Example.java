package com.calor.ast;

public record Example(
    TextSpan span,
    String id,
    String message,  // Can be null
    Expression expression,
    Expression expected
) implements Node {

    @Override
    public String type() {
        return "Example";
    }
}
