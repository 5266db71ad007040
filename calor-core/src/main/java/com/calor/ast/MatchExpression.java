package com.calor.ast;

import java.util.List;

public record MatchExpression(
    TextSpan span,
    String id,
    Expression target,
    List<MatchCase> cases
) implements Expression {

    @Override
    public String type() {
        return "MatchExpression";
    }
}
