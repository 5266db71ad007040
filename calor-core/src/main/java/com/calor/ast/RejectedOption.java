package com.calor.ast;

import java.util.List;

public record RejectedOption(
    TextSpan span,
    String name,
    List<String> reasons
) implements Node {

    @Override
    public String type() {
        return "RejectedOption";
    }
}
