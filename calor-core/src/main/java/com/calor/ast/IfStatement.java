package com.calor.ast;

import java.util.List;

public record IfStatement(
    TextSpan span,
    String id,
    Expression condition,
    List<Statement> thenBody,
    List<ElseIfClause> elseIfClauses,
    List<Statement> elseBody  // Can be null
) implements Statement {

    @Override
    public String type() {
        return "IfStatement";
    }
}
