package com.calor.ast;

import java.util.List;

public record EnumExtension(
    TextSpan span,
    String id,
    String enumName,
    List<FunctionDefinition> methods
) implements Declaration {

    @Override
    public String type() {
        return "EnumExtension";
    }
}
