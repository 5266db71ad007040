package com.calor.ast;

import java.util.List;

public record UsedBy(
    TextSpan span,
    List<Dependency> dependencies,
    boolean unknownCallers
) implements Node {

    @Override
    public String type() {
        return "UsedBy";
    }
}
