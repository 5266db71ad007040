package com.calor.ast;

/**
 * Statements that may appear in a function, method, accessor or lambda body.
 */
public sealed interface Statement extends Node permits
    CallStatement,
    ReturnStatement,
    PrintStatement,
    BindStatement,
    IfStatement,
    ForStatement,
    WhileStatement,
    DoWhileStatement,
    ForeachStatement,
    MatchStatement,
    TryStatement,
    UsingStatement,
    AssignmentStatement,
    ThrowStatement,
    RethrowStatement,
    BreakStatement,
    ContinueStatement,
    EventSubscription,
    CollectionPush,
    DictionaryPut,
    CollectionRemove,
    CollectionSetIndex,
    CollectionClear,
    CollectionInsert,
    DictionaryForeach,
    ExpressionStatement {
}
