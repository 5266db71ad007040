package com.calor.ast;

import java.util.List;

public record ClassDefinition(
    TextSpan span,
    String id,
    String name,
    String baseClass,  // Can be null
    List<String> interfaces,
    List<TypeParameter> typeParameters,
    boolean abstractClass,
    boolean sealedClass,
    boolean staticClass,
    boolean partial,
    boolean struct,
    boolean readOnly,
    List<FieldDefinition> fields,
    List<PropertyDefinition> properties,
    List<ConstructorDefinition> constructors,
    List<MethodDefinition> methods,
    List<EventDefinition> events
) implements Declaration {

    @Override
    public String type() {
        return "ClassDefinition";
    }
}
