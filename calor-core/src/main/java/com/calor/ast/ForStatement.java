package com.calor.ast;

import java.util.List;

public record ForStatement(
    TextSpan span,
    String id,
    String variable,
    Expression from,
    Expression to,
    Expression step,  // Can be null
    List<Statement> body
) implements Statement {

    @Override
    public String type() {
        return "ForStatement";
    }
}
