package com.calor.diagnostics;

import com.calor.ast.TextSpan;

/**
 * One reported problem. {@code fix} is null unless a machine-applicable correction exists.
 */
public record Diagnostic(
    String code,
    String message,
    TextSpan span,
    Severity severity,
    String filePath,
    SuggestedFix fix
) {
    public Diagnostic(String code, String message, TextSpan span, Severity severity, String filePath) {
        this(code, message, span, severity, filePath, null);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public boolean hasFix() {
        return fix != null;
    }

    @Override
    public String toString() {
        String location = filePath == null || filePath.isEmpty() ? "" : filePath;
        return location + "(" + span.line() + "," + span.column() + "): "
            + severity.name().toLowerCase() + " " + code + ": " + message;
    }
}
