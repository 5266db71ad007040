package com.calor.diagnostics;

import com.calor.TokenType;
import com.calor.ast.TextSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Append-only collector for diagnostics. A single bag is shared by the lexer, the parser and
 * every nested parser created for embedded expressions, so reports arrive in source order
 * of discovery rather than strictly by position.
 */
public final class DiagnosticBag implements Iterable<Diagnostic> {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private String currentFilePath = "";

    public DiagnosticBag() {
    }

    public DiagnosticBag(String filePath) {
        setFilePath(filePath);
    }

    public void setFilePath(String filePath) {
        this.currentFilePath = filePath == null ? "" : filePath;
    }

    public String getCurrentFilePath() {
        return currentFilePath;
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> getErrors() {
        List<Diagnostic> errors = new ArrayList<>();
        for (Diagnostic d : diagnostics) {
            if (d.isError()) {
                errors.add(d);
            }
        }
        return errors;
    }

    public boolean hasErrors() {
        for (Diagnostic d : diagnostics) {
            if (d.isError()) {
                return true;
            }
        }
        return false;
    }

    public int errorCount() {
        return getErrors().size();
    }

    public int size() {
        return diagnostics.size();
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    @Override
    public Iterator<Diagnostic> iterator() {
        return getDiagnostics().iterator();
    }

    /**
     * @throws SyntaxErrorException if any error-severity diagnostic has been reported
     */
    public void throwIfErrors() {
        List<Diagnostic> errors = getErrors();
        if (!errors.isEmpty()) {
            throw new SyntaxErrorException(errors);
        }
    }

    // ========================================================================
    // Generic reporting
    // ========================================================================

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void reportError(TextSpan span, String code, String message) {
        diagnostics.add(new Diagnostic(code, message, span, Severity.ERROR, currentFilePath));
    }

    public void reportWarning(TextSpan span, String code, String message) {
        diagnostics.add(new Diagnostic(code, message, span, Severity.WARNING, currentFilePath));
    }

    public void reportInfo(TextSpan span, String code, String message) {
        diagnostics.add(new Diagnostic(code, message, span, Severity.INFO, currentFilePath));
    }

    public void reportErrorWithFix(TextSpan span, String code, String message, SuggestedFix fix) {
        diagnostics.add(new Diagnostic(code, message, span, Severity.ERROR, currentFilePath, fix));
    }

    // ========================================================================
    // Lexer problems
    // ========================================================================

    public void reportUnexpectedCharacter(TextSpan span, char c) {
        reportError(span, DiagnosticCode.UNEXPECTED_CHARACTER, "Unexpected character '" + c + "'");
    }

    public void reportUnterminatedString(TextSpan span) {
        reportError(span, DiagnosticCode.UNTERMINATED_STRING, "Unterminated string literal");
    }

    public void reportInvalidTypedLiteral(TextSpan span, String typeName) {
        reportError(span, DiagnosticCode.INVALID_TYPED_LITERAL, "Invalid " + typeName + " literal");
    }

    public void reportInvalidEscapeSequence(TextSpan span, char c) {
        reportError(span, DiagnosticCode.INVALID_ESCAPE_SEQUENCE, "Invalid escape sequence '\\" + c + "'");
    }

    // ========================================================================
    // Parser problems
    // ========================================================================

    public void reportUnexpectedToken(TextSpan span, String expected, TokenType actual) {
        reportError(span, DiagnosticCode.UNEXPECTED_TOKEN,
            "Expected " + expected + " but found " + actual);
    }

    public void reportUnexpectedToken(TextSpan span, TokenType expected, TokenType actual) {
        reportUnexpectedToken(span, expected.name(), actual);
    }

    public void reportMissingRequiredAttribute(TextSpan span, String tagName, String attributeName) {
        reportError(span, DiagnosticCode.MISSING_REQUIRED_ATTRIBUTE,
            "Missing required attribute '" + attributeName + "' on " + tagName);
    }

    /**
     * Reports a close tag whose id differs from its open tag. The fix rewrites the close id,
     * assuming the id directly follows the close tag as {@code §/X{id}}.
     */
    public void reportMismatchedIdWithFix(TextSpan closeSpan, String openTag, String openId,
                                          String closeTag, String closeId) {
        String message = closeTag + " id '" + closeId + "' does not match " + openTag + " id '" + openId + "'";
        int idColumn = closeSpan.column() + closeSpan.length() + 1;
        TextEdit edit = TextEdit.replace(currentFilePath, closeSpan.line(), idColumn,
            closeSpan.line(), idColumn + closeId.length(), openId);
        SuggestedFix fix = new SuggestedFix("Change closing id '" + closeId + "' to '" + openId + "'", edit);
        reportErrorWithFix(closeSpan, DiagnosticCode.MISMATCHED_ID, message, fix);
    }

    public void reportMissingExtensionSelf(TextSpan span, String methodName, String enumName) {
        reportError(span, DiagnosticCode.MISSING_EXTENSION_SELF,
            "Extension method '" + methodName + "' has no parameter of type '" + enumName + "'");
    }
}
