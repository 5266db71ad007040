package com.calor.ast;

public record Dependency(
    TextSpan span,
    String target,
    String version,  // Can be null
    boolean optional
) implements Node {

    @Override
    public String type() {
        return "Dependency";
    }
}
