package com.calor.ast;

import java.util.List;

public record CallExpression(
    TextSpan span,
    String target,
    boolean fallible,
    List<Expression> arguments
) implements Expression {

    @Override
    public String type() {
        return "CallExpression";
    }
}
