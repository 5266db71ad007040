package com.calor.ast;

import java.util.List;

public record WhileStatement(
    TextSpan span,
    String id,
    Expression condition,
    List<Statement> body
) implements Statement {

    @Override
    public String type() {
        return "WhileStatement";
    }
}
