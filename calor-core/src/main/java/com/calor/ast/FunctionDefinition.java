package com.calor.ast;

import java.util.List;

public record FunctionDefinition(
    TextSpan span,
    String id,
    String name,
    Visibility visibility,
    List<TypeParameter> typeParameters,
    List<Parameter> parameters,
    OutputSpec output,  // Can be null
    EffectsSpec effects,  // Can be null
    List<RequiresClause> preconditions,
    List<EnsuresClause> postconditions,
    List<Statement> body,
    FunctionMetadata metadata,
    boolean async
) implements Declaration {

    @Override
    public String type() {
        return "FunctionDefinition";
    }
}
