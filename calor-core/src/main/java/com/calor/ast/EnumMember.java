package com.calor.ast;

public record EnumMember(
    TextSpan span,
    String name,
    String value  // Can be null
) implements Node {

    @Override
    public String type() {
        return "EnumMember";
    }
}
