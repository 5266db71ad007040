package com.calor.ast;

import java.util.List;

/**
 * Root of a parsed module ({@code §M{id:name} ... §/M{id}}).
 */
public record Program(
    TextSpan span,
    String id,
    String name,
    List<UsingDirective> usings,
    List<InterfaceDefinition> interfaces,
    List<ClassDefinition> classes,
    List<FunctionDefinition> functions,
    List<DelegateDefinition> delegates,
    List<EnumDefinition> enums,
    List<EnumExtension> enumExtensions,
    List<Issue> issues,
    List<Assumption> assumptions,
    List<Invariant> invariants,
    List<Decision> decisions,
    ContextBlock context  // Can be null
) implements Node {

    @Override
    public String type() {
        return "Program";
    }
}
