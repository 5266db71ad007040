package com.calor;

import com.calor.ast.Program;
import com.calor.diagnostics.DiagnosticBag;

/**
 * A program tree together with every diagnostic reported while lexing and parsing it.
 * The tree is always present; it may contain placeholder nodes when {@code diagnostics}
 * holds errors.
 */
public record ParseResult(Program program, DiagnosticBag diagnostics) {

    public boolean hasErrors() {
        return diagnostics.hasErrors();
    }
}
