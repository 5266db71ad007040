package com.calor.ast;

public record DictionaryPut(
    TextSpan span,
    String dictionary,
    Expression key,
    Expression value
) implements Statement {

    @Override
    public String type() {
        return "DictionaryPut";
    }
}
