package com.calor.ast;

public enum QuantifierKind {
    FORALL,
    EXISTS
}
