package com.calor.ast;

import java.util.List;

public record ArrayCreation(
    TextSpan span,
    String id,
    String name,
    String elementType,
    Expression size,  // Can be null
    List<Expression> initializer
) implements Expression {

    @Override
    public String type() {
        return "ArrayCreation";
    }
}
