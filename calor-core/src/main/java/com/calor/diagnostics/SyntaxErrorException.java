package com.calor.diagnostics;

import java.util.List;

/**
 * Raised by callers that want to treat any reported error as fatal. The parser itself
 * never throws this; it is produced by {@link DiagnosticBag#throwIfErrors()}.
 */
public class SyntaxErrorException extends RuntimeException {

    private final List<Diagnostic> diagnostics;

    public SyntaxErrorException(List<Diagnostic> diagnostics) {
        super(buildMessage(diagnostics));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    private static String buildMessage(List<Diagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            return "Syntax error";
        }
        Diagnostic first = diagnostics.get(0);
        if (diagnostics.size() == 1) {
            return first.toString();
        }
        return first + " (and " + (diagnostics.size() - 1) + " more)";
    }
}
