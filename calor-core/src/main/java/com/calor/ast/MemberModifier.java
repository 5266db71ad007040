package com.calor.ast;

public enum MemberModifier {
    VIRTUAL,
    OVERRIDE,
    ABSTRACT,
    SEALED,
    STATIC,
    CONST,
    READONLY
}
