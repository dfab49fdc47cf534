package com.elara.pine.codegen;

import java.util.Collections;
import java.util.List;

/** Output of one generation run. */
public final class GeneratedCode {
    private final String code;
    private final List<GeneratorWarning> warnings;
    private final List<PlotConfig> plots;
    private final List<FillConfig> fills;
    private final GeneratorContext context;

    GeneratedCode(String code, List<GeneratorWarning> warnings, List<PlotConfig> plots,
                  List<FillConfig> fills, GeneratorContext context) {
        this.code = code;
        this.warnings = Collections.unmodifiableList(warnings);
        this.plots = Collections.unmodifiableList(plots);
        this.fills = Collections.unmodifiableList(fills);
        this.context = context;
    }

    public String code() { return code; }
    public List<GeneratorWarning> warnings() { return warnings; }
    public List<PlotConfig> plots() { return plots; }
    public List<FillConfig> fills() { return fills; }
    public GeneratorContext context() { return context; }
}
