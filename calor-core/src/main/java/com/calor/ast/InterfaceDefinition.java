package com.calor.ast;

import java.util.List;

public record InterfaceDefinition(
    TextSpan span,
    String id,
    String name,
    List<TypeParameter> typeParameters,
    List<String> baseInterfaces,
    List<MethodSignature> methods
) implements Declaration {

    @Override
    public String type() {
        return "InterfaceDefinition";
    }
}
