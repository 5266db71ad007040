package com.calor.ast;

import java.util.List;

public record ForeachStatement(
    TextSpan span,
    String id,
    String variable,
    String variableType,
    Expression collection,
    List<Statement> body
) implements Statement {

    @Override
    public String type() {
        return "ForeachStatement";
    }
}
