package com.calor.ast;

import java.util.List;

public record Uses(
    TextSpan span,
    List<Dependency> dependencies
) implements Node {

    @Override
    public String type() {
        return "Uses";
    }
}
