package com.calor.ast;

public record Assumption(
    TextSpan span,
    AssumptionCategory category,  // Can be null
    String text
) implements Node {

    @Override
    public String type() {
        return "Assumption";
    }
}
