package com.calor.ast;

public record FieldAccess(
    TextSpan span,
    Expression target,
    String fieldName
) implements Expression {

    @Override
    public String type() {
        return "FieldAccess";
    }
}
