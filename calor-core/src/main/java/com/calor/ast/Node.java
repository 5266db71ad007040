package com.calor.ast;

/**
 * Base interface for all Calor program tree nodes. Every node carries the span covering the
 * first and last token it consumed.
 */
public sealed interface Node permits
    Program,
    Declaration,
    Statement,
    Expression,
    Pattern,
    UsingDirective,
    Parameter,
    OutputSpec,
    EffectsSpec,
    RequiresClause,
    EnsuresClause,
    TypeParameter,
    TypeConstraint,
    Example,
    Issue,
    Dependency,
    Uses,
    UsedBy,
    Assumption,
    Complexity,
    Since,
    Deprecation,
    BreakingChange,
    PropertyTest,
    Lock,
    Author,
    TaskRef,
    Invariant,
    Decision,
    RejectedOption,
    ContextBlock,
    FileRef,
    MethodSignature,
    MethodDefinition,
    FieldDefinition,
    PropertyDefinition,
    PropertyAccessor,
    ConstructorDefinition,
    ConstructorInitializer,
    EventDefinition,
    EnumMember,
    ElseIfClause,
    MatchCase,
    CatchClause,
    QuantifierVariable,
    LambdaParameter,
    FieldAssignment,
    KeyValuePair,
    ObjectInitializer,
    PropertyMatch {

    String type();
    TextSpan span();
}
