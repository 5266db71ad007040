package com.calor.ast;

public record BreakingChange(
    TextSpan span,
    String version,
    String description
) implements Node {

    @Override
    public String type() {
        return "BreakingChange";
    }
}
