package com.calor.ast;

public record Deprecation(
    TextSpan span,
    String since,
    String replacement  // Can be null
) implements Node {

    @Override
    public String type() {
        return "Deprecation";
    }
}
