package com.calor.ast;

public record Since(
    TextSpan span,
    String version
) implements Node {

    @Override
    public String type() {
        return "Since";
    }
}
