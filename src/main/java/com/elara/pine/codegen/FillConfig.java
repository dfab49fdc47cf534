package com.elara.pine.codegen;

import java.util.ArrayList;
import java.util.List;

/** A shaded region between two plots, exported in fillConfig. */
public final class FillConfig {
    private final String id;
    private final String plot1;
    private final String plot2;
    private final String color;
    private final String title;   // may be null
    private final String visible; // may be null

    public FillConfig(String id, String plot1, String plot2, String color, String title, String visible) {
        this.id = id;
        this.plot1 = plot1;
        this.plot2 = plot2;
        this.color = color;
        this.title = title;
        this.visible = visible;
    }

    public String id() { return id; }
    public String plot1() { return plot1; }
    public String plot2() { return plot2; }
    public String color() { return color; }
    public String title() { return title; }
    public String visible() { return visible; }

    String render() {
        List<String> parts = new ArrayList<>();
        parts.add("id: '" + id + "'");
        parts.add("plot1: '" + plot1 + "'");
        parts.add("plot2: '" + plot2 + "'");
        parts.add("color: '" + color + "'");
        if (title != null && !title.isEmpty()) parts.add("title: '" + Preamble.singleQuoted(title) + "'");
        if (visible != null) parts.add("visible: '" + visible + "'");
        return "{ " + String.join(", ", parts) + " }";
    }
}
