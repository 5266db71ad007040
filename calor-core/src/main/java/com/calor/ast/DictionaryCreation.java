package com.calor.ast;

import java.util.List;

public record DictionaryCreation(
    TextSpan span,
    String id,
    String name,
    String keyType,
    String valueType,
    List<KeyValuePair> entries
) implements Expression {

    @Override
    public String type() {
        return "DictionaryCreation";
    }
}
