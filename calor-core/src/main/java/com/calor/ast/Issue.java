package com.calor.ast;

public record Issue(
    TextSpan span,
    IssueKind kind,
    String id,
    String category,
    IssuePriority priority,
    String description
) implements Node {

    @Override
    public String type() {
        return "Issue";
    }
}
