package com.elara.pine.codegen;

import java.util.HashMap;
import java.util.Map;

import com.elara.pine.parser.Expr;
import com.elara.pine.parser.Expr.ExprInterface;

/** Resolves color names and color expressions to hex strings for plot and fill configs. */
public final class ColorMapper {

    public static final String DEFAULT_PLOT_COLOR = "#2962FF";
    public static final String DEFAULT_FILL_COLOR = "#00FF00";

    private static final Map<String, String> COLORS = new HashMap<>();

    static {
        COLORS.put("blue", "#2962FF");
        COLORS.put("red", "#FF0000");
        COLORS.put("green", "#00FF00");
        COLORS.put("yellow", "#FFFF00");
        COLORS.put("orange", "#FF6D00");
        COLORS.put("purple", "#9C27B0");
        COLORS.put("gray", "#787B86");
        COLORS.put("white", "#FFFFFF");
        COLORS.put("black", "#000000");

        COLORS.put("color.green", "#00FF00");
        COLORS.put("color.red", "#FF0000");
        COLORS.put("color.blue", "#0000FF");
        COLORS.put("color.white", "#FFFFFF");
        COLORS.put("color.black", "#000000");
        COLORS.put("color.yellow", "#FFFF00");
        COLORS.put("color.orange", "#FFA500");
        COLORS.put("color.purple", "#800080");
        COLORS.put("color.gray", "#808080");
        COLORS.put("color.silver", "#C0C0C0");
        COLORS.put("color.aqua", "#00FFFF");
        COLORS.put("color.lime", "#00FF00");
        COLORS.put("color.maroon", "#800000");
        COLORS.put("color.navy", "#000080");
        COLORS.put("color.olive", "#808000");
        COLORS.put("color.teal", "#008080");
        COLORS.put("color.fuchsia", "#FF00FF");
    }

    private ColorMapper() {}

    /** Hex value for a color name; unknown names pass through and null becomes black. */
    public static String toHex(String color) {
        if (color == null || color.isEmpty()) return "#000000";
        String hex = COLORS.get(color);
        return hex != null ? hex : color;
    }

    /** Best-effort static color of an expression, falling back to the given default. */
    public static String colorOf(ExprInterface expr, String fallback) {
        if (expr instanceof Expr.StringLiteral) {
            String value = ((Expr.StringLiteral) expr).value;
            return value.isEmpty() ? fallback : value;
        }
        if (expr instanceof Expr.Member) {
            String path = ((Expr.Member) expr).path;
            if (path.startsWith("color.") && path.indexOf('.', 6) < 0) {
                String name = path.substring(6);
                String hex = COLORS.get(name);
                if (hex == null) hex = COLORS.get(path);
                return hex != null ? hex : fallback;
            }
        }
        if (expr instanceof Expr.Call) {
            // color.new(base, transparency) keeps the base color
            Expr.Call call = (Expr.Call) expr;
            if ("color.new".equals(call.callee) && call.positional(0) != null) {
                return colorOf(call.positional(0), fallback);
            }
        }
        return fallback;
    }
}
