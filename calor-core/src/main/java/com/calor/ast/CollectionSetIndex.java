package com.calor.ast;

public record CollectionSetIndex(
    TextSpan span,
    String collection,
    Expression index,
    Expression value
) implements Statement {

    @Override
    public String type() {
        return "CollectionSetIndex";
    }
}
