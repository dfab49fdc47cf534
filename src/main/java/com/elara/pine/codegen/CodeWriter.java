package com.elara.pine.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Line buffer with two-space indentation. */
public final class CodeWriter {
    public static final String INDENT = "  ";

    private final List<String> lines = new ArrayList<>();
    private int level;

    public void line(String text) {
        if (text.isEmpty()) {
            lines.add("");
            return;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < level; i++) sb.append(INDENT);
        lines.add(sb.append(text).toString());
    }

    public void blank() {
        lines.add("");
    }

    public void lines(List<String> block) {
        for (String l : block) {
            line(l);
        }
    }

    public void indent() {
        level++;
    }

    public void dedent() {
        if (level > 0) level--;
    }

    public int level() {
        return level;
    }

    /** Reserves a line to be filled in later; returns its index. */
    public int placeholder() {
        lines.add("");
        return lines.size() - 1;
    }

    public void set(int index, String text) {
        lines.set(index, text);
    }

    public int size() {
        return lines.size();
    }

    public List<String> lines() {
        return Collections.unmodifiableList(lines);
    }

    @Override
    public String toString() {
        return String.join("\n", lines);
    }
}
