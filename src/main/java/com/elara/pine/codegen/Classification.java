package com.elara.pine.codegen;

/** Static shape of an expression's value: one number per bar, or a single value. */
public enum Classification {
    SERIES,
    SCALAR
}
