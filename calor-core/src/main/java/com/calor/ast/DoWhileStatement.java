package com.calor.ast;

import java.util.List;

public record DoWhileStatement(
    TextSpan span,
    String id,
    List<Statement> body,
    Expression condition
) implements Statement {

    @Override
    public String type() {
        return "DoWhileStatement";
    }
}
