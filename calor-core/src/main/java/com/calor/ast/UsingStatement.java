package com.calor.ast;

import java.util.List;

public record UsingStatement(
    TextSpan span,
    String id,
    String variable,  // Can be null
    String typeName,  // Can be null
    Expression resource,
    List<Statement> body
) implements Statement {

    @Override
    public String type() {
        return "UsingStatement";
    }
}
