package com.calor.diagnostics;

public enum Severity {
    ERROR,
    WARNING,
    INFO
}
