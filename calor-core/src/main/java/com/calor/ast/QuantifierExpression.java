package com.calor.ast;

import java.util.List;

public record QuantifierExpression(
    TextSpan span,
    QuantifierKind kind,
    List<QuantifierVariable> boundVariables,
    Expression body
) implements Expression {

    @Override
    public String type() {
        return "QuantifierExpression";
    }
}
