package com.calor.ast;

public record ImplicationExpression(
    TextSpan span,
    Expression antecedent,
    Expression consequent
) implements Expression {

    @Override
    public String type() {
        return "ImplicationExpression";
    }
}
