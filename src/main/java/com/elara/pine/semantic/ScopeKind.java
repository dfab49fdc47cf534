package com.elara.pine.semantic;

public enum ScopeKind {
    GLOBAL,
    FUNCTION,
    BLOCK,
    LOOP
}
