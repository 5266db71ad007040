package com.calor.ast;

import java.util.List;

public record PropertyDefinition(
    TextSpan span,
    String id,
    String name,
    String typeName,
    Visibility visibility,
    List<MemberModifier> modifiers,
    PropertyAccessor getter,  // Can be null
    PropertyAccessor setter,  // Can be null
    PropertyAccessor initer,  // Can be null
    Expression defaultValue  // Can be null
) implements Node {

    @Override
    public String type() {
        return "PropertyDefinition";
    }
}
