package com.calor.ast;

public record QuantifierVariable(
    TextSpan span,
    String name,
    String typeName
) implements Node {

    @Override
    public String type() {
        return "QuantifierVariable";
    }
}
