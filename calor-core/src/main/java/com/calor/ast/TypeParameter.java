package com.calor.ast;

import java.util.List;

public record TypeParameter(
    TextSpan span,
    String name,
    List<TypeConstraint> constraints
) implements Node {

    @Override
    public String type() {
        return "TypeParameter";
    }
}
