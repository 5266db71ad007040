package com.calor.ast;

import java.util.List;

public record PositionalPattern(
    TextSpan span,
    String typeName,
    List<Pattern> patterns
) implements Pattern {

    @Override
    public String type() {
        return "PositionalPattern";
    }
}
