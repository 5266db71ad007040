package com.calor.ast;

import java.util.List;

public record MethodDefinition(
    TextSpan span,
    String id,
    String name,
    Visibility visibility,
    List<MemberModifier> modifiers,
    List<TypeParameter> typeParameters,
    List<Parameter> parameters,
    OutputSpec output,  // Can be null
    EffectsSpec effects,  // Can be null
    List<RequiresClause> preconditions,
    List<EnsuresClause> postconditions,
    List<Statement> body,
    boolean async
) implements Node {

    @Override
    public String type() {
        return "MethodDefinition";
    }
}
