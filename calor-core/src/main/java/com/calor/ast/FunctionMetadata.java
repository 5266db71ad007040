package com.calor.ast;

import java.util.List;

/**
 * Optional header sections of a function: examples, issues, dependencies and the
 * agent-coordination markers. Single-valued sections are null when absent.
 */
public record FunctionMetadata(
    List<Example> examples,
    List<Issue> issues,
    Uses uses,
    UsedBy usedBy,
    List<Assumption> assumptions,
    Complexity complexity,
    Since since,
    Deprecation deprecated,
    List<BreakingChange> breakingChanges,
    List<PropertyTest> propertyTests,
    Lock lock,
    Author author,
    TaskRef taskRef
) {

    public static final FunctionMetadata NONE = new FunctionMetadata(
        List.of(), List.of(), null, null, List.of(), null, null, null, List.of(), List.of(), null, null, null);
}
