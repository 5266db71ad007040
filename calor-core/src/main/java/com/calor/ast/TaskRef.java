package com.calor.ast;

public record TaskRef(
    TextSpan span,
    String id,
    String description
) implements Node {

    @Override
    public String type() {
        return "TaskRef";
    }
}
