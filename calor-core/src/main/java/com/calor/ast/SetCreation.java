package com.calor.ast;

import java.util.List;

public record SetCreation(
    TextSpan span,
    String id,
    String name,
    String elementType,
    List<Expression> elements
) implements Expression {

    @Override
    public String type() {
        return "SetCreation";
    }
}
