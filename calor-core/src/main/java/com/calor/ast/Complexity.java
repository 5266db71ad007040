package com.calor.ast;

public record Complexity(
    TextSpan span,
    ComplexityClass time,  // Can be null
    ComplexityClass space  // Can be null
) implements Node {

    @Override
    public String type() {
        return "Complexity";
    }
}
