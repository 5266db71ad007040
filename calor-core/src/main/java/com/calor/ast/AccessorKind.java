package com.calor.ast;

public enum AccessorKind {
    GET,
    SET,
    INIT
}
