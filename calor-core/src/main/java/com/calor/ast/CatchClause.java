package com.calor.ast;

import java.util.List;

public record CatchClause(
    TextSpan span,
    String exceptionType,  // Null catches everything
    String variable,  // Can be null
    Expression filter,  // Can be null
    List<Statement> body
) implements Node {

    @Override
    public String type() {
        return "CatchClause";
    }
}
