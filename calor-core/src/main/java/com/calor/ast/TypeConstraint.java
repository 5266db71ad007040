package com.calor.ast;

public record TypeConstraint(
    TextSpan span,
    TypeConstraintKind kind,
    String typeName  // Only set for TYPE_NAME
) implements Node {

    @Override
    public String type() {
        return "TypeConstraint";
    }
}
