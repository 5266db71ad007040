package com.calor.ast;

public record FieldAssignment(
    TextSpan span,
    String name,
    Expression value
) implements Node {

    @Override
    public String type() {
        return "FieldAssignment";
    }
}
