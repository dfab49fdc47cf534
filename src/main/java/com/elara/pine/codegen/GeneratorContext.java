package com.elara.pine.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.elara.pine.parser.Expr.ExprInterface;

/**
 * Program-wide facts gathered by {@link InfoCollector} before any text is emitted.
 * Built once per compilation and read-only afterwards.
 */
public final class GeneratorContext {

    private final String title;
    private final String shortTitle;
    private final boolean overlay;
    private final LibraryInfo library;
    private final List<ImportInfo> imports;
    private final Map<String, TypeInfo> types;
    private final Map<String, List<MethodInfo>> methods;
    private final List<InputDefinition> inputs;
    private final Map<String, String> variables;
    private final Set<String> seriesNames;
    private final Set<String> reassigned;
    private final Set<String> recursive;
    private final Set<String> functions;
    private final Map<String, String> declaredTypes;
    private final boolean usesSyminfo;
    private final boolean usesTimeframe;
    private final Set<String> timeSeries;
    private final boolean usesBarIndex;
    private final Map<ExprInterface, Classification> classifications;

    private GeneratorContext(Builder b) {
        this.title = b.title;
        this.shortTitle = b.shortTitle != null ? b.shortTitle : b.title;
        this.overlay = b.overlay;
        this.library = b.library;
        this.imports = Collections.unmodifiableList(new ArrayList<>(b.imports));
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(b.types));
        Map<String, List<MethodInfo>> m = new LinkedHashMap<>();
        for (Map.Entry<String, List<MethodInfo>> e : b.methods.entrySet()) {
            m.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
        }
        this.methods = Collections.unmodifiableMap(m);
        this.inputs = Collections.unmodifiableList(new ArrayList<>(b.inputs));
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(b.variables));
        this.seriesNames = Collections.unmodifiableSet(new LinkedHashSet<>(b.seriesNames));
        this.reassigned = Collections.unmodifiableSet(new LinkedHashSet<>(b.reassigned));
        this.recursive = Collections.unmodifiableSet(new LinkedHashSet<>(b.recursive));
        this.functions = Collections.unmodifiableSet(new LinkedHashSet<>(b.functions));
        this.declaredTypes = Collections.unmodifiableMap(new LinkedHashMap<>(b.declaredTypes));
        this.usesSyminfo = b.usesSyminfo;
        this.usesTimeframe = b.usesTimeframe;
        this.timeSeries = Collections.unmodifiableSet(new LinkedHashSet<>(b.timeSeries));
        this.usesBarIndex = b.usesBarIndex;
        this.classifications = Collections.unmodifiableMap(new IdentityHashMap<>(b.classifications));
    }

    public String title() { return title; }
    public String shortTitle() { return shortTitle; }
    public boolean isOverlay() { return overlay; }
    public boolean isLibrary() { return library != null; }
    public LibraryInfo library() { return library; }
    public List<ImportInfo> imports() { return imports; }
    public Map<String, TypeInfo> types() { return types; }
    public Map<String, String> variables() { return variables; }
    public List<InputDefinition> inputs() { return inputs; }
    public Set<String> seriesNames() { return seriesNames; }
    public Set<String> reassigned() { return reassigned; }
    public Set<String> recursive() { return recursive; }
    public Set<String> functions() { return functions; }
    public boolean usesSyminfo() { return usesSyminfo; }
    public boolean usesTimeframe() { return usesTimeframe; }
    public Set<String> timeSeries() { return timeSeries; }
    public boolean usesBarIndex() { return usesBarIndex; }

    public List<MethodInfo> methodsOf(String typeName) {
        List<MethodInfo> list = methods.get(typeName);
        return list != null ? list : Collections.<MethodInfo>emptyList();
    }

    public boolean hasMethod(String typeName, String method) {
        for (MethodInfo m : methodsOf(typeName)) {
            if (m.name().equals(method)) return true;
        }
        return false;
    }

    /** User type a variable was declared with or instantiated as, or null. */
    public String declaredTypeOf(String variable) {
        return declaredTypes.get(variable);
    }

    public boolean isReassigned(String name) { return reassigned.contains(name); }
    public boolean isRecursive(String name) { return recursive.contains(name); }

    /** True when the target name denotes a series. */
    public boolean isSeriesName(String targetName) {
        return seriesNames.contains(targetName);
    }

    public Classification classificationOf(ExprInterface expr) {
        Classification c = expr == null ? null : classifications.get(expr);
        return c != null ? c : Classification.SCALAR;
    }

    public boolean isSeries(ExprInterface expr) {
        return classificationOf(expr) == Classification.SERIES;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String title = "Indicator";
        private String shortTitle;
        private boolean overlay;
        private LibraryInfo library;
        private final List<ImportInfo> imports = new ArrayList<>();
        private final Map<String, TypeInfo> types = new LinkedHashMap<>();
        private final Map<String, List<MethodInfo>> methods = new LinkedHashMap<>();
        private final List<InputDefinition> inputs = new ArrayList<>();
        private final Map<String, String> variables = new LinkedHashMap<>();
        private final Set<String> seriesNames = new LinkedHashSet<>();
        private final Set<String> reassigned = new LinkedHashSet<>();
        private final Set<String> recursive = new LinkedHashSet<>();
        private final Set<String> functions = new LinkedHashSet<>();
        private final Map<String, String> declaredTypes = new LinkedHashMap<>();
        private boolean usesSyminfo;
        private boolean usesTimeframe;
        private final Set<String> timeSeries = new LinkedHashSet<>();
        private boolean usesBarIndex;
        private final Map<ExprInterface, Classification> classifications = new IdentityHashMap<>();

        private Builder() {}

        public Builder title(String title) { this.title = title; return this; }
        public Builder shortTitle(String shortTitle) { this.shortTitle = shortTitle; return this; }
        public Builder overlay(boolean overlay) { this.overlay = overlay; return this; }
        public Builder library(LibraryInfo library) { this.library = library; return this; }
        public Builder addImport(ImportInfo info) { imports.add(info); return this; }
        public Builder addType(TypeInfo info) { types.put(info.name(), info); return this; }

        public Builder addMethod(MethodInfo info) {
            methods.computeIfAbsent(info.boundType(), k -> new ArrayList<>()).add(info);
            return this;
        }

        public Builder addInput(InputDefinition input) { inputs.add(input); return this; }
        public Builder mapVariable(String name, String target) { variables.put(name, target); return this; }
        public Builder addSeries(String targetName) { seriesNames.add(targetName); return this; }
        public Builder addReassigned(String name) { reassigned.add(name); return this; }
        public Builder addRecursive(String name) { recursive.add(name); return this; }
        public Builder addFunction(String name) { functions.add(name); return this; }
        public Builder declaredType(String variable, String typeName) { declaredTypes.put(variable, typeName); return this; }
        public Builder usesSyminfo(boolean v) { this.usesSyminfo = v; return this; }
        public Builder usesTimeframe(boolean v) { this.usesTimeframe = v; return this; }
        public Builder addTimeSeries(String name) { timeSeries.add(name); return this; }
        public Builder usesBarIndex(boolean v) { this.usesBarIndex = v; return this; }
        public Builder classify(ExprInterface expr, Classification c) { classifications.put(expr, c); return this; }

        public GeneratorContext build() {
            return new GeneratorContext(this);
        }
    }
}
