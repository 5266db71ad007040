package com.calor.ast;

public record CollectionInsert(
    TextSpan span,
    String collection,
    Expression index,
    Expression value
) implements Statement {

    @Override
    public String type() {
        return "CollectionInsert";
    }
}
