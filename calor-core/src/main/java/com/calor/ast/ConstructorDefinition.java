package com.calor.ast;

import java.util.List;

public record ConstructorDefinition(
    TextSpan span,
    String id,
    Visibility visibility,
    List<Parameter> parameters,
    List<RequiresClause> preconditions,
    ConstructorInitializer initializer,  // Can be null
    List<Statement> body
) implements Node {

    @Override
    public String type() {
        return "ConstructorDefinition";
    }
}
