package com.calor.ast;

public record EventSubscription(
    TextSpan span,
    Expression event,
    Expression handler,
    boolean subscribe
) implements Statement {

    @Override
    public String type() {
        return "EventSubscription";
    }
}
