package com.calor.ast;

public record CollectionPush(
    TextSpan span,
    String collection,
    Expression value
) implements Statement {

    @Override
    public String type() {
        return "CollectionPush";
    }
}
