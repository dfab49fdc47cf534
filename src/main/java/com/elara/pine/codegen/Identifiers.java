package com.elara.pine.codegen;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/** Text helpers shared by the emitters. */
public final class Identifiers {

    private static final Pattern INVALID = Pattern.compile("[^a-zA-Z0-9_]");
    private static final Pattern UNDERSCORE_RUN = Pattern.compile("_{2,}");

    private Identifiers() {}

    /**
     * Turns an arbitrary title or name into a valid target identifier.
     * "My RSI (14)" becomes "My_RSI_14"; an empty result becomes "unnamed".
     */
    public static String sanitize(String name) {
        if (name == null) return "unnamed";
        String s = INVALID.matcher(name).replaceAll("_");
        s = UNDERSCORE_RUN.matcher(s).replaceAll("_");
        if (s.startsWith("_")) s = s.substring(1);
        if (s.endsWith("_")) s = s.substring(0, s.length() - 1);
        if (s.isEmpty()) return "unnamed";
        // identifiers may not start with a digit
        return Character.isDigit(s.charAt(0)) ? "_" + s : s;
    }

    /** Shortest decimal text for a number: 14.0 becomes "14", 0.5 stays "0.5". */
    public static String formatNumber(double value) {
        if (Double.isNaN(value)) return "NaN";
        if (Double.isInfinite(value)) return value > 0 ? "Infinity" : "-Infinity";
        if (value == 0) return "0";
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /** Double-quoted string literal with backslashes, quotes and line breaks escaped. */
    public static String quote(String value) {
        String s = value == null ? "" : value;
        return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"")
                .replace("\n", "\\n").replace("\r", "\\r").replace("\t", "\\t") + "\"";
    }

    /** Strips one pair of surrounding single or double quotes. */
    static String unquote(String text) {
        String s = text;
        if (s.startsWith("\"") || s.startsWith("'")) s = s.substring(1);
        if (s.endsWith("\"") || s.endsWith("'")) s = s.substring(0, s.length() - 1);
        return s;
    }
}
