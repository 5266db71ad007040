package com.calor.ast;

public enum IssueKind {
    TODO,
    FIXME,
    HACK
}
