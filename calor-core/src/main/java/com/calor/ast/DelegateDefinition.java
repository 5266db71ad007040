package com.calor.ast;

import java.util.List;

public record DelegateDefinition(
    TextSpan span,
    String id,
    String name,
    List<Parameter> parameters,
    OutputSpec output,  // Can be null
    EffectsSpec effects  // Can be null
) implements Declaration {

    @Override
    public String type() {
        return "DelegateDefinition";
    }
}
