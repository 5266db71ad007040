package com.calor.ast;

/**
 * Patterns used by match cases.
 */
public sealed interface Pattern extends Node permits
    WildcardPattern,
    VariablePattern,
    VarPattern,
    LiteralPattern,
    ConstantPattern,
    RelationalPattern,
    SomePattern,
    NonePattern,
    OkPattern,
    ErrPattern,
    PositionalPattern,
    PropertyPattern,
    ListPattern {
}
