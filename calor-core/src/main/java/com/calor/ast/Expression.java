package com.calor.ast;

/**
 * Expression nodes.
 */
public sealed interface Expression extends Node permits
    IntLiteral,
    FloatLiteral,
    DecimalLiteral,
    StringLiteral,
    BoolLiteral,
    Reference,
    FieldAccess,
    NullConditional,
    ArrayAccess,
    BinaryOperation,
    UnaryOperation,
    ConditionalExpression,
    NullCoalesce,
    StringOperation,
    CharOperation,
    StringBuilderOperation,
    TypeOperation,
    TypeOfExpression,
    IsPatternExpression,
    QuantifierExpression,
    ImplicationExpression,
    KeywordArgument,
    LambdaExpression,
    SomeExpression,
    NoneExpression,
    OkExpression,
    ErrExpression,
    RecordCreation,
    MatchExpression,
    ArrayCreation,
    ArrayLength,
    ListCreation,
    DictionaryCreation,
    SetCreation,
    CollectionContains,
    CollectionCount,
    NewExpression,
    AnonymousObject,
    ThisExpression,
    BaseExpression,
    CallExpression,
    ExpressionCall,
    AwaitExpression,
    InterpolatedString,
    RangeExpression,
    IndexFromEnd,
    WithExpression {
}
