package com.calor.ast;

import java.util.List;

public record LambdaExpression(
    TextSpan span,
    String id,
    List<LambdaParameter> parameters,
    EffectsSpec effects,  // Can be null
    boolean async,
    Expression expressionBody,  // Set when the body is a single expression
    List<Statement> statementBody  // Set when the body is a statement block
) implements Expression {

    @Override
    public String type() {
        return "LambdaExpression";
    }
}
