package com.elara.pine.codegen;

import java.util.Map;

/** Maps declared source type names onto target type annotations and default values. */
public final class TypeMapper {

    private TypeMapper() {}

    public static String toTarget(String typeName, Map<String, TypeInfo> userTypes) {
        if (typeName == null || typeName.isEmpty()) return "any";
        if (typeName.startsWith("array<") && typeName.endsWith(">")) {
            return toTarget(typeName.substring(6, typeName.length() - 1), userTypes) + "[]";
        }
        switch (typeName) {
            case "int":
            case "float":
                return "number";
            case "bool":
                return "boolean";
            case "string":
            case "color":
                return "string";
            case "line":
                return "Line | null";
            case "label":
                return "Label | null";
            case "box":
                return "Box | null";
            case "table":
                return "Table | null";
            case "chart.point":
                return "ChartPoint";
            default:
                return userTypes.containsKey(typeName) ? typeName : "any";
        }
    }

    public static String defaultValue(String typeName) {
        if (typeName == null) return "null";
        if (typeName.startsWith("array<")) return "[]";
        switch (typeName) {
            case "int":
                return "0";
            case "float":
                return "0.0";
            case "bool":
                return "false";
            case "string":
                return "\"\"";
            case "color":
                return "\"#000000\"";
            default:
                return "null";
        }
    }
}
