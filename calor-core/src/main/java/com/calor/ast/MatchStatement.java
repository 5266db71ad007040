package com.calor.ast;

import java.util.List;

public record MatchStatement(
    TextSpan span,
    String id,
    Expression target,
    List<MatchCase> cases
) implements Statement {

    @Override
    public String type() {
        return "MatchStatement";
    }
}
