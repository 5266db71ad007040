package com.calor.ast;

import java.util.List;

public record AnonymousObject(
    TextSpan span,
    List<ObjectInitializer> initializers
) implements Expression {

    @Override
    public String type() {
        return "AnonymousObject";
    }
}
