package com.calor.ast;

public enum TypeConstraintKind {
    CLASS,
    STRUCT,
    NEW,
    TYPE_NAME
}
