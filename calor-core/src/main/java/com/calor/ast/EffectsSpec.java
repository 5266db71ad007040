package com.calor.ast;

import java.util.Map;

/**
 * Declared side effects, keyed by category. Repeated codes in one category are comma-joined.
 */
public record EffectsSpec(
    TextSpan span,
    Map<String, String> effects
) implements Node {

    @Override
    public String type() {
        return "EffectsSpec";
    }
}
