package com.calor.ast;

/**
 * Top-level type and function declarations inside a module.
 */
public sealed interface Declaration extends Node permits
    FunctionDefinition,
    ClassDefinition,
    InterfaceDefinition,
    DelegateDefinition,
    EnumDefinition,
    EnumExtension {
}
