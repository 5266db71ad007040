package com.calor.ast;

public record AssignmentStatement(
    TextSpan span,
    Expression target,
    Expression value
) implements Statement {

    @Override
    public String type() {
        return "AssignmentStatement";
    }
}
