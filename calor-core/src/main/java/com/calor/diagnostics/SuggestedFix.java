package com.calor.diagnostics;

import java.util.List;

public record SuggestedFix(String description, List<TextEdit> edits) {

    public SuggestedFix {
        edits = List.copyOf(edits);
    }

    public SuggestedFix(String description, TextEdit edit) {
        this(description, List.of(edit));
    }
}
