package com.elara.pine.codegen;

public enum InputType {
    INT("int", "number", "0"),
    FLOAT("float", "number", "0.0"),
    BOOL("bool", "boolean", "false"),
    STRING("string", "string", ""),
    COLOR("color", "string", "#000000"),
    SOURCE("source", "string", "close");

    private final String label;
    private final String targetType;
    private final String fallbackDefault;

    InputType(String label, String targetType, String fallbackDefault) {
        this.label = label;
        this.targetType = targetType;
        this.fallbackDefault = fallbackDefault;
    }

    public String label() { return label; }
    public String targetType() { return targetType; }
    public String fallbackDefault() { return fallbackDefault; }

    /** Type for an input.* call name, or null when the name is not an input call. */
    public static InputType forCall(String callee) {
        switch (callee) {
            case "input.int": return INT;
            case "input.float": return FLOAT;
            case "input.bool": return BOOL;
            case "input.string": return STRING;
            case "input.color": return COLOR;
            case "input.source": return SOURCE;
            case "input.price": return FLOAT;
            case "input.timeframe":
            case "input.session":
            case "input.symbol":
            case "input.text_area":
                return STRING;
            default: return null;
        }
    }

    public static boolean isInputCall(String callee) {
        return "input".equals(callee) || callee.startsWith("input.");
    }
}
