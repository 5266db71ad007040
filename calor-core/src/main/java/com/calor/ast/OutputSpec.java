package com.calor.ast;

public record OutputSpec(
    TextSpan span,
    String typeName
) implements Node {

    @Override
    public String type() {
        return "OutputSpec";
    }
}
