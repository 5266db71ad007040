package com.calor.ast;

import java.util.List;

public record ListPattern(
    TextSpan span,
    List<Pattern> patterns,
    String rest  // Name bound to the rest slice; can be null
) implements Pattern {

    @Override
    public String type() {
        return "ListPattern";
    }
}
