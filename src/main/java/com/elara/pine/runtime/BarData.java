package com.elara.pine.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bar list with a version counter.
 *
 * Every mutating call that changes the contents bumps the version, and
 * {@link Series} compares it against the version its cache was built at.
 * Single writer only.
 */
public final class BarData {

    private static final ObjectMapper om = new ObjectMapper();

    private List<Bar> bars;
    private long version;

    public BarData() {
        this(new ArrayList<>());
    }

    public BarData(List<Bar> bars) {
        if (bars == null) throw new IllegalArgumentException("bars must not be null");
        this.bars = new ArrayList<>(bars);
    }

    public static BarData from(List<Bar> bars) {
        return new BarData(bars);
    }

    /**
     * Reads a JSON array of {@code {time, open, high, low, close, volume?}} objects.
     * Missing price fields become NaN.
     */
    public static BarData fromJson(String json) throws IOException {
        JsonNode root = om.readTree(json);
        if (root == null || !root.isArray()) {
            throw new IOException("Expected a JSON array of bars");
        }
        List<Bar> out = new ArrayList<>(root.size());
        for (JsonNode n : root) {
            out.add(new Bar(
                    n.path("time").asLong(0L),
                    number(n, "open"),
                    number(n, "high"),
                    number(n, "low"),
                    number(n, "close"),
                    number(n, "volume")));
        }
        return new BarData(out);
    }

    private static double number(JsonNode n, String field) {
        JsonNode v = n.path(field);
        return v.isNumber() ? v.asDouble() : Double.NaN;
    }

    public long version() {
        return version;
    }

    /** Read-only view; mutate through this class so the version moves. */
    public List<Bar> bars() {
        return Collections.unmodifiableList(bars);
    }

    public int length() {
        return bars.size();
    }

    /** Bar at index, or null when out of range. */
    public Bar at(int index) {
        if (index < 0 || index >= bars.size()) return null;
        return bars.get(index);
    }

    public void push(Bar bar) {
        bars.add(bar);
        version++;
    }

    public Bar pop() {
        if (bars.isEmpty()) return null;
        Bar removed = bars.remove(bars.size() - 1);
        version++;
        return removed;
    }

    /** Replaces the bar at index. Out-of-range indexes are ignored. */
    public void set(int index, Bar bar) {
        if (index < 0 || index >= bars.size()) return;
        bars.set(index, bar);
        version++;
    }

    public void updateLast(Bar bar) {
        if (bars.isEmpty()) return;
        bars.set(bars.size() - 1, bar);
        version++;
    }

    public void setAll(List<Bar> replacement) {
        this.bars = new ArrayList<>(replacement == null ? Collections.<Bar>emptyList() : replacement);
        version++;
    }

    public void invalidate() {
        version++;
    }

    List<Bar> rawBars() {
        return bars;
    }
}
