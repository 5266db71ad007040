package com.calor.ast;

import java.util.List;

public record RecordCreation(
    TextSpan span,
    String typeName,
    List<FieldAssignment> fields
) implements Expression {

    @Override
    public String type() {
        return "RecordCreation";
    }
}
