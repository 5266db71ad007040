package com.calor.diagnostics;

/**
 * A single textual replacement. Positions are 1-based and the end column is exclusive.
 */
public record TextEdit(
    String filePath,
    int startLine,
    int startColumn,
    int endLine,
    int endColumn,
    String newText
) {
    public static TextEdit replace(String filePath, int startLine, int startColumn,
                                   int endLine, int endColumn, String newText) {
        return new TextEdit(filePath, startLine, startColumn, endLine, endColumn, newText);
    }

    public static TextEdit insert(String filePath, int line, int column, String text) {
        return new TextEdit(filePath, line, column, line, column, text);
    }
}
