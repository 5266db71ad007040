package com.calor.ast;

import java.util.List;

public record InterpolatedString(
    TextSpan span,
    List<Expression> parts
) implements Expression {

    @Override
    public String type() {
        return "InterpolatedString";
    }
}
