package com.calor.ast;

import java.util.List;

public record DictionaryForeach(
    TextSpan span,
    String id,
    String keyVariable,
    String valueVariable,
    Expression dictionary,
    List<Statement> body
) implements Statement {

    @Override
    public String type() {
        return "DictionaryForeach";
    }
}
