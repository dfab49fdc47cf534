package com.elara.pine.semantic;

public enum SemanticErrorKind {
    UNDEFINED_VARIABLE,
    UNDEFINED_FUNCTION,
    TYPE_MISMATCH,
    INVALID_ASSIGNMENT,
    CONST_REASSIGNMENT,
    INVALID_HISTORY_ACCESS,
    WRONG_ARGUMENT_COUNT,
    WRONG_ARGUMENT_TYPE,
    BREAK_OUTSIDE_LOOP,
    CONTINUE_OUTSIDE_LOOP,
    DUPLICATE_DECLARATION,
    INVALID_OPERATOR
}
