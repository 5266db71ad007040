package com.calor.ast;

public record CollectionContains(
    TextSpan span,
    String collection,
    ContainsMode mode,
    Expression value
) implements Expression {

    @Override
    public String type() {
        return "CollectionContains";
    }
}
