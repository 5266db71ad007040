package com.calor.ast;

public enum AssumptionCategory {
    ENV,
    AUTH,
    DATA,
    TIMING,
    RESOURCE
}
