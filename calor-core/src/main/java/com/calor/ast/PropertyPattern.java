package com.calor.ast;

import java.util.List;

public record PropertyPattern(
    TextSpan span,
    String typeName,
    List<PropertyMatch> matches
) implements Pattern {

    @Override
    public String type() {
        return "PropertyPattern";
    }
}
