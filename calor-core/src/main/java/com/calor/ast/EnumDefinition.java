package com.calor.ast;

import java.util.List;

public record EnumDefinition(
    TextSpan span,
    String id,
    String name,
    String underlyingType,  // Can be null
    List<EnumMember> members
) implements Declaration {

    @Override
    public String type() {
        return "EnumDefinition";
    }
}
