package com.calor;

/**
 * Per-parse settings.
 *
 * @param filePath path stamped into diagnostics and suggested fixes; may be empty
 * @param maxSuggestionDistance edit-distance threshold for operator and tag suggestions
 */
public record ParserOptions(String filePath, int maxSuggestionDistance) {

    public static final int DEFAULT_SUGGESTION_DISTANCE = 2;

    public static final ParserOptions DEFAULTS = new ParserOptions("", DEFAULT_SUGGESTION_DISTANCE);

    public ParserOptions {
        if (filePath == null) {
            filePath = "";
        }
        if (maxSuggestionDistance < 0) {
            throw new IllegalArgumentException("maxSuggestionDistance must be >= 0, got " + maxSuggestionDistance);
        }
    }

    public ParserOptions(String filePath) {
        this(filePath, DEFAULT_SUGGESTION_DISTANCE);
    }

    public ParserOptions withFilePath(String path) {
        return new ParserOptions(path, maxSuggestionDistance);
    }
}
