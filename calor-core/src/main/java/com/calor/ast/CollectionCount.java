package com.calor.ast;

public record CollectionCount(
    TextSpan span,
    Expression collection
) implements Expression {

    @Override
    public String type() {
        return "CollectionCount";
    }
}
