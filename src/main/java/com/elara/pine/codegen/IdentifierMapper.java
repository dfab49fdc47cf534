package com.elara.pine.codegen;

import java.util.HashMap;
import java.util.Map;

/** Translates source identifiers and dotted member paths into target expressions. */
public final class IdentifierMapper {

    private static final Map<String, String> BUILTINS = new HashMap<>();
    private static final Map<String, String> BARSTATE = new HashMap<>();

    static {
        BUILTINS.put("na", "NaN");
        BUILTINS.put("true", "true");
        BUILTINS.put("false", "false");
        BUILTINS.put("bar_index", "i");
        BUILTINS.put("this", "self");

        // whole history is computed at once, so the bar state is that of the last confirmed bar
        BARSTATE.put("barstate.isfirst", "false");
        BARSTATE.put("barstate.islast", "true");
        BARSTATE.put("barstate.isconfirmed", "true");
        BARSTATE.put("barstate.islastconfirmedhistory", "true");
        BARSTATE.put("barstate.isrealtime", "false");
        BARSTATE.put("barstate.isnew", "false");
    }

    private IdentifierMapper() {}

    public static String translate(String name, Map<String, String> variables) {
        String builtin = BUILTINS.get(name);
        if (builtin != null) return builtin;
        String mapped = variables.get(name);
        if (mapped != null) return mapped;
        return Identifiers.sanitize(name);
    }

    public static String translateMember(String path) {
        if (path.startsWith("color.")) {
            return "\"" + path.substring("color.".length()) + "\"";
        }
        if (path.startsWith("this.")) {
            return "self." + path.substring("this.".length());
        }
        String barstate = BARSTATE.get(path);
        if (barstate != null) return barstate;
        return path;
    }
}
