package com.calor.ast;

import java.util.List;

public record CharOperation(
    TextSpan span,
    CharOp operation,
    List<Expression> arguments
) implements Expression {

    @Override
    public String type() {
        return "CharOperation";
    }
}
