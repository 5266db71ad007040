package com.calor.ast;

import java.util.List;

public record NewExpression(
    TextSpan span,
    String typeName,
    List<String> typeArguments,
    List<Expression> arguments,
    List<ObjectInitializer> initializers
) implements Expression {

    @Override
    public String type() {
        return "NewExpression";
    }
}
