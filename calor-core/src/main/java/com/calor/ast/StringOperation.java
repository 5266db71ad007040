package com.calor.ast;

import java.util.List;

public record StringOperation(
    TextSpan span,
    StringOp operation,
    List<Expression> arguments,
    StringComparisonMode comparisonMode  // Can be null
) implements Expression {

    @Override
    public String type() {
        return "StringOperation";
    }
}
