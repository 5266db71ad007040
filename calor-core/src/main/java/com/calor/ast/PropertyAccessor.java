package com.calor.ast;

import java.util.List;

public record PropertyAccessor(
    TextSpan span,
    AccessorKind kind,
    Visibility visibility,  // Null means the property's own visibility
    List<RequiresClause> preconditions,
    List<Statement> body
) implements Node {

    @Override
    public String type() {
        return "PropertyAccessor";
    }
}
