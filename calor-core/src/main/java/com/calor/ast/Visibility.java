package com.calor.ast;

public enum Visibility {
    PUBLIC,
    PROTECTED,
    INTERNAL,
    PRIVATE
}
