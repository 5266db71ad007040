package com.calor.ast;

public enum IssuePriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
