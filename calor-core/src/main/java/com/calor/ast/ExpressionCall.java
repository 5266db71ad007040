package com.calor.ast;

import java.util.List;

public record ExpressionCall(
    TextSpan span,
    Expression target,
    List<Expression> arguments
) implements Expression {

    @Override
    public String type() {
        return "ExpressionCall";
    }
}
