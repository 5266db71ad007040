package com.calor.ast;

public record FileRef(
    TextSpan span,
    String path,
    String description  // Can be null
) implements Node {

    @Override
    public String type() {
        return "FileRef";
    }
}
