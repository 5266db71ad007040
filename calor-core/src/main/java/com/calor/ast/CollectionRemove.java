package com.calor.ast;

public record CollectionRemove(
    TextSpan span,
    String collection,
    Expression value
) implements Statement {

    @Override
    public String type() {
        return "CollectionRemove";
    }
}
