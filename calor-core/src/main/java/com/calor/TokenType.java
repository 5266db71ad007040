package com.calor;

public enum TokenType {
    // Literals and names
    IDENTIFIER,
    INT_LITERAL,
    STR_LITERAL,
    BOOL_LITERAL,
    FLOAT_LITERAL,
    DECIMAL_LITERAL,
    RAW_CSHARP,

    // Punctuation
    OPEN_BRACE,
    CLOSE_BRACE,
    OPEN_BRACKET,
    CLOSE_BRACKET,
    OPEN_PAREN,
    CLOSE_PAREN,
    EQUALS,
    COLON,
    EXCLAMATION,
    TILDE,
    HASH,
    QUESTION,
    AT,
    COMMA,
    DOT,
    BACKSLASH,
    ARROW,

    // Operator symbols used inside prefix expressions
    PLUS,
    MINUS,
    STAR,
    STAR_STAR,
    SLASH,
    PERCENT,
    EQUAL_EQUAL,
    BANG_EQUAL,
    LESS,
    LESS_EQUAL,
    LESS_LESS,
    GREATER,
    GREATER_EQUAL,
    GREATER_GREATER,
    AMP,
    AMP_AMP,
    PIPE,
    PIPE_PIPE,
    CARET,

    // Core tags
    MODULE, END_MODULE,
    FUNC, END_FUNC,
    CALL, END_CALL,
    BIND,
    RETURN,
    IN,
    OUT,
    ARG,
    EFFECTS,
    FOR, END_FOR,
    MATCH, END_MATCH,
    CASE, END_CASE,
    REQUIRES,
    ENSURES,
    TYPE, END_TYPE,
    RECORD, END_RECORD,
    VARIANT,
    USING,

    // Control flow
    IF, END_IF,
    ELSE_IF,
    ELSE,
    WHILE, END_WHILE,
    DO, END_DO,
    BREAK,
    CONTINUE,
    BODY, END_BODY,

    // Option / result / records
    SOME,
    NONE,
    OK,
    ERR,
    FIELD,
    INVARIANT,

    // Using statement
    USE, END_USE,

    // Arrays and collections
    ARRAY, END_ARRAY,
    INDEX,
    LENGTH,
    FOREACH, END_FOREACH,
    LIST, END_LIST,
    DICT, END_DICT,
    HASH_SET, END_HASH_SET,
    KEY_VALUE,
    PUSH,
    ADD,
    PUT,
    REMOVE,
    SET_INDEX,
    CLEAR,
    INSERT,
    HAS,
    KEY,
    VAL,
    EACH_KV, END_EACH_KV,
    COUNT,

    // Generics
    WHERE,

    // Classes and interfaces
    CLASS, END_CLASS,
    INTERFACE, END_INTERFACE,
    IMPLEMENTS,
    EXTENDS,
    METHOD, END_METHOD,
    VIRTUAL,
    OVERRIDE,
    ABSTRACT,
    SEALED,
    THIS, END_THIS,
    BASE, END_BASE,
    NEW, END_NEW,
    FIELD_DEF,
    PROPERTY, END_PROPERTY,
    GET, END_GET,
    SET, END_SET,
    INIT,
    CONSTRUCTOR, END_CONSTRUCTOR,
    ASSIGN,
    DEFAULT,

    // Exceptions
    TRY, END_TRY,
    CATCH,
    FINALLY,
    THROW,
    RETHROW,
    WHEN,

    // Lambdas, delegates, events
    LAMBDA, END_LAMBDA,
    DELEGATE, END_DELEGATE,
    EVENT,
    SUBSCRIBE,
    UNSUBSCRIBE,

    // Async
    ASYNC,
    AWAIT,
    ASYNC_FUNC, END_ASYNC_FUNC,
    ASYNC_METHOD, END_ASYNC_METHOD,

    // Modern operators
    INTERPOLATE, END_INTERPOLATE,
    NULL_COALESCE,
    NULL_CONDITIONAL,
    RANGE_OP,
    INDEX_END,
    EXPRESSION,
    WITH, END_WITH,

    // Patterns
    POSITIONAL_PATTERN,
    PROPERTY_PATTERN,
    PROPERTY_MATCH,
    RELATIONAL_PATTERN,
    LIST_PATTERN,
    VAR,
    REST,

    // Enums
    ENUM, END_ENUM,
    ENUM_EXTENSION, END_ENUM_EXTENSION,

    // Metadata
    EXAMPLE,
    TODO,
    FIXME,
    HACK,
    USES, END_USES,
    USED_BY, END_USED_BY,
    ASSUME,
    COMPLEXITY,
    SINCE,
    DEPRECATED,
    BREAKING,
    EXPERIMENTAL,
    STABLE,
    DECISION, END_DECISION,
    CHOSEN,
    REJECTED,
    REASON,
    CONTEXT, END_CONTEXT,
    VISIBLE, END_VISIBLE,
    HIDDEN_SECTION, END_HIDDEN_SECTION,
    FOCUS,
    FILE_REF,
    PROPERTY_TEST,
    LOCK,
    AGENT_AUTHOR,
    TASK_REF,
    DATE_MARKER,

    // Yield and anonymous objects
    YIELD,
    YIELD_BREAK,
    ANONYMOUS_OBJECT, END_ANONYMOUS_OBJECT,

    // Console aliases
    PRINT,
    PRINT_F,

    ERROR,
    EOF
}
