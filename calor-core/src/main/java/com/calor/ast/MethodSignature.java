package com.calor.ast;

import java.util.List;

public record MethodSignature(
    TextSpan span,
    String id,
    String name,
    List<TypeParameter> typeParameters,
    List<Parameter> parameters,
    OutputSpec output,  // Can be null
    EffectsSpec effects,  // Can be null
    List<RequiresClause> preconditions,
    List<EnsuresClause> postconditions
) implements Node {

    @Override
    public String type() {
        return "MethodSignature";
    }
}
