package com.calor.ast;

import java.util.List;

public record CallStatement(
    TextSpan span,
    String target,
    boolean fallible,
    List<Expression> arguments
) implements Statement {

    @Override
    public String type() {
        return "CallStatement";
    }
}
