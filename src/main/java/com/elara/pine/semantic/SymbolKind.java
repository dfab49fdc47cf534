package com.elara.pine.semantic;

public enum SymbolKind {
    VARIABLE,
    FUNCTION,
    TYPE,
    METHOD,
    PARAMETER
}
