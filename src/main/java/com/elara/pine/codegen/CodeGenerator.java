package com.elara.pine.codegen;

import java.util.ArrayList;
import java.util.List;

import com.elara.debug.Debug;
import com.elara.pine.TranspileOptions;
import com.elara.pine.parser.Statement.Stmt;

/**
 * Turns an analyzed program into target source. Each call builds its own context and
 * emission state, so one generator can serve many compilations.
 */
public class CodeGenerator {

    private static final String TAG = "CodeGenerator";

    private final TranspileOptions options;

    public CodeGenerator() {
        this(new TranspileOptions());
    }

    public CodeGenerator(TranspileOptions options) {
        this.options = options == null ? new TranspileOptions() : options;
    }

    /** Runs the collector pass and then emits. */
    public GeneratedCode generate(List<Stmt> statements) {
        GeneratorContext ctx = new InfoCollector().collect(statements);
        return generate(statements, ctx);
    }

    public GeneratedCode generate(List<Stmt> statements, GeneratorContext ctx) {
        EmissionState state = new EmissionState();
        CodeWriter out = new CodeWriter();
        ExpressionGenerator exprs = new ExpressionGenerator(ctx, state, out);
        StatementGenerator body = new StatementGenerator(ctx, state, out, exprs);

        // the facility list is only known once the body is written
        int importLine = -1;
        if (options.isIncludeImports()) {
            importLine = out.placeholder();
            out.lines(Preamble.libraryImports(ctx.imports(), options.getLibraryPath()));
            out.blank();
        }

        if (!ctx.types().isEmpty()) {
            body.functions().emitTypes();
        }

        boolean hasInputs = !ctx.inputs().isEmpty();
        if (hasInputs) out.lines(Preamble.inputsInterface(ctx.inputs()));
        if (ctx.usesSyminfo()) out.lines(Preamble.syminfoInterface());
        if (ctx.usesTimeframe()) out.lines(Preamble.timeframeInterface());

        String fn = Identifiers.sanitize(ctx.title());
        out.line("export function " + fn + "("
                + Preamble.functionParams(hasInputs, ctx.usesSyminfo(), ctx.usesTimeframe()) + "): IndicatorResult {");
        out.indent();

        if (hasInputs) {
            List<String> names = new ArrayList<>();
            for (InputDefinition in : ctx.inputs()) names.add(in.name());
            out.line("const { " + String.join(", ", names) + " } = { ...defaultInputs, ...inputs };");
            out.blank();
        }
        if (ctx.usesSyminfo()) {
            out.line("const syminfo = { ...defaultSyminfo, ...syminfoParam };");
            out.blank();
        }
        if (ctx.usesTimeframe()) {
            out.line("const timeframe = { ...defaultTimeframe, ...timeframeParam };");
            out.blank();
        }
        out.lines(Preamble.ohlcv());
        out.lines(Preamble.calculatedSources());
        out.lines(Preamble.sourceMapping(ctx.inputs()));
        out.lines(Preamble.timeSeries(ctx.timeSeries()));
        if (ctx.usesBarIndex()) out.lines(Preamble.barIndex());

        body.emitAll(statements);

        out.blank();
        out.line("return {");
        out.indent();
        out.line("metadata: { title: " + Identifiers.quote(ctx.title()) + ", shorttitle: "
                + Identifiers.quote(ctx.shortTitle()) + ", overlay: " + ctx.isOverlay() + " },");
        List<String> plotEntries = new ArrayList<>();
        for (int i = 0; i < state.plots().size(); i++) {
            plotEntries.add("'" + state.plots().get(i).id() + "': " + state.plotData().get(i));
        }
        out.line(plotEntries.isEmpty() ? "plots: {}," : "plots: { " + String.join(", ", plotEntries) + " },");
        out.dedent();
        out.line("};");
        out.dedent();
        out.line("}");

        emitExports(out, ctx, state, fn);

        if (importLine >= 0) {
            out.set(importLine, Preamble.mainImport(state.imports().imports(), options.getRuntimeModule()));
        }

        Debug.get().d(TAG, "lines=" + out.size() + " plots=" + state.plots().size()
                + " fills=" + state.fills().size() + " warnings=" + state.warnings().size());
        return new GeneratedCode(out.toString(), state.warnings(), state.plots(), state.fills(), ctx);
    }

    private void emitExports(CodeWriter out, GeneratorContext ctx, EmissionState state, String fn) {
        out.blank();
        out.line("// Additional exports for compatibility");
        out.line("export const metadata = { title: " + Identifiers.quote(ctx.title()) + ", shortTitle: "
                + Identifiers.quote(ctx.shortTitle()) + ", overlay: " + ctx.isOverlay() + " };");

        if (!ctx.inputs().isEmpty()) {
            out.line("export { defaultInputs };");
            out.line("export const inputConfig: InputConfig[] = " + Preamble.inputConfigArray(ctx.inputs()) + ";");
        } else {
            out.line("export const defaultInputs = {};");
            out.line("export const inputConfig: InputConfig[] = [];");
        }

        List<String> plots = new ArrayList<>();
        for (PlotConfig p : state.plots()) plots.add(p.render());
        out.line("export const plotConfig: PlotConfig[] = [" + String.join(", ", plots) + "];");

        if (!state.fills().isEmpty()) {
            List<String> fills = new ArrayList<>();
            for (FillConfig f : state.fills()) fills.add(f.render());
            out.line("export const fillConfig = [" + String.join(", ", fills) + "];");
        }

        out.line("export const calculate = " + fn + ";");
        out.line("export { " + fn + " as " + fn + "Indicator };");
        out.line("export type " + fn + "Inputs = "
                + (ctx.inputs().isEmpty() ? "Record<string, never>" : "IndicatorInputs") + ";");
    }
}
