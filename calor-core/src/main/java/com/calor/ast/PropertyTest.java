package com.calor.ast;

import java.util.List;

public record PropertyTest(
    TextSpan span,
    List<String> quantifiers,
    Expression predicate
) implements Node {

    @Override
    public String type() {
        return "PropertyTest";
    }
}
