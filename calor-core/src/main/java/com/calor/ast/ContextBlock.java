package com.calor.ast;

import java.util.List;

public record ContextBlock(
    TextSpan span,
    boolean partial,
    List<FileRef> visibleFiles,
    List<FileRef> hiddenFiles,
    String focus  // Can be null
) implements Node {

    @Override
    public String type() {
        return "ContextBlock";
    }
}
