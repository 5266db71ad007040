package com.calor.ast;

import java.util.List;

public record WithExpression(
    TextSpan span,
    Expression target,
    List<ObjectInitializer> assignments
) implements Expression {

    @Override
    public String type() {
        return "WithExpression";
    }
}
