package com.calor.ast;

public record Reference(
    TextSpan span,
    String name
) implements Expression {

    @Override
    public String type() {
        return "Reference";
    }
}
