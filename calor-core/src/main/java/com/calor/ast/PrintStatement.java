package com.calor.ast;

public record PrintStatement(
    TextSpan span,
    Expression expression,
    boolean writeLine
) implements Statement {

    @Override
    public String type() {
        return "PrintStatement";
    }
}
