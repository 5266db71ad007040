package com.calor.ast;

import java.util.List;

public record TryStatement(
    TextSpan span,
    String id,
    List<Statement> tryBody,
    List<CatchClause> catchClauses,
    List<Statement> finallyBody  // Can be null
) implements Statement {

    @Override
    public String type() {
        return "TryStatement";
    }
}
