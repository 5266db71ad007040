package com.calor.ast;

import java.util.List;

public record StringBuilderOperation(
    TextSpan span,
    StringBuilderOp operation,
    List<Expression> arguments
) implements Expression {

    @Override
    public String type() {
        return "StringBuilderOperation";
    }
}
