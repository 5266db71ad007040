package com.calor.ast;

public record UsingDirective(
    TextSpan span,
    String namespace,
    String alias,  // Can be null
    boolean staticImport
) implements Node {

    @Override
    public String type() {
        return "UsingDirective";
    }
}
