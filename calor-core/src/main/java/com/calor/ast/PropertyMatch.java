package com.calor.ast;

public record PropertyMatch(
    TextSpan span,
    String propertyName,
    Pattern pattern
) implements Node {

    @Override
    public String type() {
        return "PropertyMatch";
    }
}
