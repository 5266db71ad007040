package com.calor.ast;

public record CollectionClear(
    TextSpan span,
    String collection
) implements Statement {

    @Override
    public String type() {
        return "CollectionClear";
    }
}
