package com.calor.ast;

public enum TypeOp {
    CAST,
    IS,
    AS
}
