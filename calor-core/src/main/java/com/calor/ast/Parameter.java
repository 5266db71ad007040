package com.calor.ast;

public record Parameter(
    TextSpan span,
    String name,
    String typeName,
    String semantic  // Can be null
) implements Node {

    @Override
    public String type() {
        return "Parameter";
    }
}
