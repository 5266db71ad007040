package com.calor.ast;

import java.time.LocalDate;

public record Author(
    TextSpan span,
    String agentId,
    LocalDate date,
    String taskId  // Can be null
) implements Node {

    @Override
    public String type() {
        return "Author";
    }
}
