package com.calor.ast;

public record BindStatement(
    TextSpan span,
    String name,
    String typeName,  // Can be null
    boolean mutable,
    Expression initializer  // Can be null
) implements Statement {

    @Override
    public String type() {
        return "BindStatement";
    }
}
