package com.elara.pine.codegen;

import java.util.ArrayList;
import java.util.List;

/** Static description of one plot() call, exported in plotConfig. */
public final class PlotConfig {
    private final String id;
    private final String title;
    private final String color;
    private final double lineWidth;
    private final String display; // null when not given
    private final String visible; // condition text or null
    private final double offset;

    public PlotConfig(String id, String title, String color, double lineWidth,
                      String display, String visible, double offset) {
        this.id = id;
        this.title = title;
        this.color = color;
        this.lineWidth = lineWidth;
        this.display = display;
        this.visible = visible;
        this.offset = offset;
    }

    public String id() { return id; }
    public String title() { return title; }
    public String color() { return color; }
    public double lineWidth() { return lineWidth; }
    public String display() { return display; }
    public String visible() { return visible; }
    public double offset() { return offset; }

    String render() {
        List<String> parts = new ArrayList<>();
        parts.add("id: '" + id + "'");
        parts.add("title: '" + Preamble.singleQuoted(title) + "'");
        parts.add("color: '" + color + "'");
        parts.add("lineWidth: " + Identifiers.formatNumber(lineWidth));
        if (display != null) parts.add("display: '" + display + "'");
        if (visible != null) parts.add("visible: '" + visible + "'");
        if (offset != 0) parts.add("offset: " + Identifiers.formatNumber(offset));
        return "{ " + String.join(", ", parts) + " }";
    }
}
