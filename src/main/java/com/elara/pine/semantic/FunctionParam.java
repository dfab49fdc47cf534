package com.elara.pine.semantic;

/** One parameter of a function type. {@code name} may be null for positional-only builtins. */
public final class FunctionParam {
    private final String name;
    private final PineType type;
    private final boolean optional;

    public FunctionParam(String name, PineType type, boolean optional) {
        this.name = name;
        this.type = type;
        this.optional = optional;
    }

    public static FunctionParam required(PineType type) {
        return new FunctionParam(null, type, false);
    }

    public static FunctionParam optional(String name, PineType type) {
        return new FunctionParam(name, type, true);
    }

    public String name() { return name; }
    public PineType type() { return type; }
    public boolean isOptional() { return optional; }
}
