package com.elara.pine.codegen;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.elara.debug.Debug;

/** Mutable bookkeeping of one emission pass: registrations, imports and warnings. */
public final class EmissionState {
    private static final String TAG = "CodeGenerator";

    private final List<String> plotData = new ArrayList<>();
    private final List<PlotConfig> plots = new ArrayList<>();
    private final List<FillConfig> fills = new ArrayList<>();
    private final Map<String, String> plotVariables = new LinkedHashMap<>();
    private final ImportTracker imports = new ImportTracker();
    private final List<GeneratorWarning> warnings = new ArrayList<>();
    private final Deque<Set<String>> declared = new ArrayDeque<>();

    public EmissionState() {
        declared.push(new HashSet<>());
    }

    public ImportTracker imports() { return imports; }
    public List<PlotConfig> plots() { return Collections.unmodifiableList(plots); }
    public List<String> plotData() { return Collections.unmodifiableList(plotData); }
    public List<FillConfig> fills() { return Collections.unmodifiableList(fills); }
    public List<GeneratorWarning> warnings() { return Collections.unmodifiableList(warnings); }

    public int nextPlotIndex() {
        return plots.size();
    }

    public void addPlot(PlotConfig config, String data) {
        plots.add(config);
        plotData.add(data);
    }

    public int nextFillIndex() {
        return fills.size();
    }

    public void addFill(FillConfig fill) {
        fills.add(fill);
    }

    /** Remembers that {@code p = plot(...)} bound {@code p} to a plot id. */
    public void recordPlotVariable(String name, String plotId) {
        plotVariables.put(name, plotId);
    }

    public String plotIdOf(String name) {
        return plotVariables.get(name);
    }

    public void warn(String message, int line, int column) {
        warnings.add(new GeneratorWarning(message, line, column));
        Debug.get().w(TAG, "line " + line + ": " + message);
    }

    public void enterBlock() {
        declared.push(new HashSet<>());
    }

    public void exitBlock() {
        if (declared.size() > 1) declared.pop();
    }

    /** Marks a name declared in the current block; false when it already was. */
    public boolean declare(String name) {
        return declared.peek().add(name);
    }

    public boolean isDeclaredInBlock(String name) {
        return declared.peek().contains(name);
    }
}
