package com.calor.ast;

public record EventDefinition(
    TextSpan span,
    String id,
    String name,
    Visibility visibility,
    String delegateType
) implements Node {

    @Override
    public String type() {
        return "EventDefinition";
    }
}
