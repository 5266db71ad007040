package com.calor.ast;

public record KeyValuePair(
    TextSpan span,
    Expression key,
    Expression value
) implements Node {

    @Override
    public String type() {
        return "KeyValuePair";
    }
}
