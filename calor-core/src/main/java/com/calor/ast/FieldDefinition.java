package com.calor.ast;

import java.util.List;

public record FieldDefinition(
    TextSpan span,
    String name,
    String typeName,
    Visibility visibility,
    List<MemberModifier> modifiers,
    Expression defaultValue  // Can be null
) implements Node {

    @Override
    public String type() {
        return "FieldDefinition";
    }
}
