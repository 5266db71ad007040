package com.calor.ast;

import java.util.List;

public record ConstructorInitializer(
    TextSpan span,
    boolean base,
    List<Expression> arguments
) implements Node {

    @Override
    public String type() {
        return "ConstructorInitializer";
    }
}
