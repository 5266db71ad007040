package com.calor.ast;

import java.util.List;

public record MatchCase(
    TextSpan span,
    Pattern pattern,
    Expression guard,  // Can be null
    List<Statement> body
) implements Node {

    @Override
    public String type() {
        return "MatchCase";
    }
}
