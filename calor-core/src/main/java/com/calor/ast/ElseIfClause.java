package com.calor.ast;

import java.util.List;

public record ElseIfClause(
    TextSpan span,
    Expression condition,
    List<Statement> body
) implements Node {

    @Override
    public String type() {
        return "ElseIfClause";
    }
}
