package com.calor.ast;

import java.time.LocalDateTime;

public record Lock(
    TextSpan span,
    String agentId,
    LocalDateTime acquired,  // Can be null
    LocalDateTime expires  // Can be null
) implements Node {

    @Override
    public String type() {
        return "Lock";
    }
}
