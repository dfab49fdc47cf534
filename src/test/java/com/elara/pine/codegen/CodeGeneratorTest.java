package com.elara.pine.codegen;

import com.elara.pine.TranspileOptions;
import com.elara.pine.parser.ParseResult;
import com.elara.pine.parser.Parser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CodeGeneratorTest {

    private static final String PLOT_MAP =
            ".toArray().map((v: number | undefined, i: number) => ({ time: bars[i]!.time, value: v ?? NaN }))";

    private static GeneratedCode generate(String src) {
        return generate(src, new TranspileOptions());
    }

    private static GeneratedCode generate(String src, TranspileOptions options) {
        ParseResult parsed = Parser.parseSource(src);
        assertFalse(parsed.hasErrors(), () -> "syntax errors: " + parsed.errors());
        return new CodeGenerator(options).generate(parsed.statements());
    }

    private static void assertContains(String code, String expected) {
        assertTrue(code.contains(expected), () -> "expected to find:\n" + expected + "\nin:\n" + code);
    }

    @Test
    void balanceOfPower_usesSeriesMethodChain_andRegistersOnePlot() {
        GeneratedCode out = generate(String.join("\n",
                "//@version=5",
                "indicator(\"Balance of Power\", format=format.price, precision=2)",
                "bop = (close - open) / (high - low)",
                "plot(bop, color=color.red, title=\"BOP\")"));
        String code = out.code();

        assertTrue(code.startsWith(
                "import { Series, type IndicatorResult, type InputConfig, type PlotConfig } from 'oakscriptjs';"), code);
        assertContains(code, "export function Balance_of_Power(bars: any[]): IndicatorResult {");
        assertContains(code, "  const bop = close.sub(open).div(high.sub(low));");
        assertFalse(code.contains("close - open"));
        assertContains(code, "plots: { 'plot0': bop" + PLOT_MAP + " },");
        assertContains(code, "metadata: { title: \"Balance of Power\", shorttitle: \"Balance of Power\", overlay: false },");
        assertContains(code, "export const plotConfig: PlotConfig[] = [{ id: 'plot0', title: 'BOP', color: '#FF0000', lineWidth: 2 }];");
        assertContains(code, "export const calculate = Balance_of_Power;");
        assertContains(code, "export { Balance_of_Power as Balance_of_PowerIndicator };");
        assertContains(code, "export type Balance_of_PowerInputs = Record<string, never>;");
        assertEquals(1, out.plots().size());
        assertTrue(out.context().isSeriesName("bop"));
        assertTrue(out.warnings().isEmpty());
    }

    @Test
    void countedLoop_isInclusive_withStep_andPlainAccumulation() {
        String code = generate(String.join("\n",
                "indicator(\"Loop\")",
                "sum = 0",
                "for i = 0 to 10 by 2 { sum := sum + i }",
                "plot(sum)")).code();

        assertContains(code, "  let sum = new Series(bars, () => 0);");
        assertContains(code, "  for (let i = 0; i <= 10; i += 2) {\n    sum = sum.add(i);\n  }");
        assertFalse(code.contains("Recursive formula"));
    }

    @Test
    void selfReferencingReassignment_isComputedBarByBar() {
        GeneratedCode out = generate(String.join("\n",
                "indicator(\"Smooth\")",
                "src = close",
                "smooth = 0.0",
                "smooth := na(smooth[1]) ? src : 0.5 * src + 0.5 * smooth[1]",
                "plot(smooth)"));
        String code = out.code();

        assertTrue(out.context().isRecursive("smooth"));
        assertContains(code, "  let smooth = new Series(bars, () => 0);");
        assertContains(code, "  // Recursive formula for smooth\n"
                + "  const smoothValues: number[] = new Array(bars.length).fill(NaN);\n"
                + "  for (let i = 0; i < bars.length; i++) {\n"
                + "    const smoothPrev = i > 0 ? smoothValues[i - 1] : NaN;\n"
                + "    smoothValues[i] = (na(smoothPrev) ? src.get(i) : ((0.5 * src.get(i)) + (0.5 * smoothPrev)));\n"
                + "  }\n"
                + "  smooth = Series.fromArray(bars, smoothValues);");
        assertTrue(code.startsWith("import { Series, na, type IndicatorResult"), code);
    }

    @Test
    void reassignmentWithoutHistoryOfItself_isNotRecursive() {
        GeneratedCode out = generate(String.join("\n",
                "indicator(\"Plain\")",
                "a = 0.0",
                "b = close",
                "a := b[1] + close",
                "plot(a)"));
        assertFalse(out.context().isRecursive("a"));
        assertContains(out.code(), "  a = b.offset(1).add(close);");
    }

    @Test
    void inputs_produceInterfaceDefaultsAndConfig() {
        GeneratedCode out = generate(String.join("\n",
                "indicator(\"RSI Test\", shorttitle=\"RSIT\", overlay=false)",
                "length = input.int(14, \"Length\", minval=1, maxval=100)",
                "src = input.source(close, title=\"Source\")",
                "r = ta.rsi(src, length)",
                "plot(r, \"RSI\", color=color.blue, linewidth=3)"));
        String code = out.code();

        assertTrue(code.startsWith("import { Series, ta, type IndicatorResult"), code);
        assertContains(code, "export interface IndicatorInputs {\n  length: number;\n  src: string;\n}");
        assertContains(code, "const defaultInputs: IndicatorInputs = {\n  length: 14,\n  src: \"close\",\n};");
        assertContains(code, "export function RSI_Test(bars: any[], inputs: Partial<IndicatorInputs> = {}): IndicatorResult {");
        assertContains(code, "  const { length, src } = { ...defaultInputs, ...inputs };");
        assertContains(code, "  const srcSeries = (() => {");
        assertContains(code, "  const r = ta.rsi(srcSeries, length);");
        assertContains(code, "export const inputConfig: InputConfig[] = [{ id: 'length', type: 'int', title: 'Length', defval: 14, min: 1, max: 100 },"
                + " { id: 'src', type: 'source', title: 'Source', defval: \"close\" }];");
        assertContains(code, "export const plotConfig: PlotConfig[] = [{ id: 'plot0', title: 'RSI', color: '#2962FF', lineWidth: 3 }];");
        assertContains(code, "export const metadata = { title: \"RSI Test\", shortTitle: \"RSIT\", overlay: false };");
        assertContains(code, "export type RSI_TestInputs = IndicatorInputs;");
        assertEquals(2, out.context().inputs().size());
    }

    @Test
    void unsupportedDisplayCalls_areSkippedWithWarning() {
        GeneratedCode out = generate(String.join("\n",
                "indicator(\"Levels\")",
                "plot(close)",
                "hline(50, \"Mid\")"));
        assertEquals(1, out.warnings().size());
        GeneratorWarning w = out.warnings().get(0);
        assertTrue(w.message().contains("hline"));
        assertEquals(3, w.line());
        assertFalse(out.code().contains("hline("));
    }

    @Test
    void fill_referencesPlotsByVariable() {
        String code = generate(String.join("\n",
                "indicator(\"Bands\", overlay=true)",
                "upper = high + 1",
                "lower = low - 1",
                "p1 = plot(upper, \"Upper\")",
                "p2 = plot(lower, \"Lower\")",
                "fill(p1, p2, color=color.green, title=\"Band\")")).code();

        assertContains(code, "  const upper = high.add(1);");
        assertContains(code, "  const lower = low.sub(1);");
        assertContains(code, "export const fillConfig = [{ id: 'fill0', plot1: 'plot0', plot2: 'plot1', color: '#00FF00', title: 'Band' }];");
        assertContains(code, "overlay: true");
    }

    @Test
    void scalarLeftOperand_isLiftedForNonCommutativeOperators() {
        String code = generate(String.join("\n",
                "indicator(\"Lift\")",
                "a = 100 - close",
                "b = 2 * close")).code();
        assertContains(code, "const a = new Series(bars, () => 100).sub(close);");
        assertContains(code, "const b = close.mul(2);");
    }

    @Test
    void ternaryWithNa_wrapsTheNaBranch() {
        String code = generate(String.join("\n",
                "indicator(\"Gate\")",
                "x = close > open ? close : na")).code();
        assertContains(code, "const x = (close.gt(open) ? close : new Series(bars, () => NaN));");
    }

    @Test
    void switchExpression_becomesImmediatelyInvokedFunction() {
        String code = generate(String.join("\n",
                "indicator(\"Switch\")",
                "x = switch",
                "    close > open => 1",
                "    => 0")).code();
        assertContains(code, "  const x = (() => {\n    if (close.gt(open)) return 1;\n    else return 0;\n  })();");
    }

    @Test
    void userFunction_andType_areEmitted() {
        String code = generate(String.join("\n",
                "indicator(\"Types\")",
                "type Point",
                "    float x = 0.0",
                "    float y = 0.0",
                "f(a, b = 2) => a + b",
                "p = Point.new(1.0, 2.0)",
                "y = f(close, 3)")).code();

        assertContains(code, "// User-defined types\ninterface Point {\n  x: number;\n  y: number;\n}");
        assertContains(code, "  new: (x: number = 0, y: number = 0): Point => ({\n    x, y,\n  }),");
        assertContains(code, "  function f(a: any, b: any = 2): any {\n    return (a + b);\n  }");
        assertContains(code, "  const p = Point.new(1, 2);");
        assertContains(code, "  const y = f(close, 3);");
    }

    @Test
    void genericArrayConstructor_becomesFilledArray() {
        String code = generate(String.join("\n",
                "indicator(\"Arr\")",
                "arr = array.new<float>(3, 0.0)")).code();
        assertContains(code, "const arr = new Array(3).fill(0);");
    }

    @Test
    void libraryImports_useAliasAndVersionedModule() {
        GeneratedCode out = generate(String.join("\n",
                "indicator(\"Lib\")",
                "import TradingView/ta/7 as tv",
                "x = tv.ema2(close, 10)",
                "plot(x)"));
        assertContains(out.code(), "import * as tv from './libs/TradingView_ta_v7';");
        assertTrue(out.context().isSeriesName("x"));
        assertContains(out.code(), "'plot0': x" + PLOT_MAP);
    }

    @Test
    void options_controlImportLine() {
        String src = String.join("\n",
                "indicator(\"Opt\")",
                "x = ta.sma(close, 5)");
        String noImports = generate(src, new TranspileOptions().setIncludeImports(false)).code();
        assertTrue(noImports.startsWith("export function Opt("), noImports);

        String custom = generate(src, new TranspileOptions().setRuntimeModule("@acme/runtime")).code();
        assertTrue(custom.startsWith("import { Series, ta, type IndicatorResult, type InputConfig, type PlotConfig } from '@acme/runtime';"), custom);
    }

    @Test
    void emptyProgram_getsDefaultTitleAndNoPlots() {
        String code = generate("x = 1").code();
        assertContains(code, "export function Indicator(bars: any[]): IndicatorResult {");
        assertContains(code, "    plots: {},");
        assertContains(code, "export const plotConfig: PlotConfig[] = [];");
        assertFalse(code.contains("fillConfig"));
    }

    @Test
    void generation_isDeterministic() {
        String src = String.join("\n",
                "indicator(\"Det\", overlay=true)",
                "len = input.int(20)",
                "basis = ta.sma(close, len)",
                "dev = ta.stdev(close, len) * 2",
                "up = basis + dev",
                "dn = basis - dev",
                "plot(basis)",
                "p1 = plot(up)",
                "p2 = plot(dn)",
                "fill(p1, p2)");
        assertEquals(generate(src).code(), generate(src).code());
    }

    @Test
    void namesReboundToSeries_areSeriesClassified() {
        GeneratedCode out = generate(String.join("\n",
                "indicator(\"Rebound\")",
                "float x = na",
                "z = na",
                "x := close - open",
                "z := high - low",
                "y = x - z",
                "w = 100 - x",
                "plot(y)"));
        String code = out.code();

        assertTrue(out.context().isSeriesName("x"));
        assertTrue(out.context().isSeriesName("z"));
        assertTrue(out.context().isSeriesName("y"));
        assertFalse(out.context().isRecursive("x"));
        assertContains(code, "  let x = new Series(bars, () => NaN);");
        assertContains(code, "  x = close.sub(open);");
        assertContains(code, "  z = high.sub(low);");
        assertContains(code, "  const y = x.sub(z);");
        assertContains(code, "  const w = new Series(bars, () => 100).sub(x);");
        assertContains(code, "'plot0': y" + PLOT_MAP);
        assertFalse(code.contains("(x - z)"));
    }

    @Test
    void reboundInsideBlock_isSeriesClassified() {
        GeneratedCode out = generate(String.join("\n",
                "indicator(\"Branch\")",
                "v = na",
                "if close > open",
                "    v := close * 2",
                "u = v + 1"));
        assertTrue(out.context().isSeriesName("v"));
        assertContains(out.code(), "const u = v.add(1);");
    }

    @Test
    void stringInputDefaults_areEscaped() {
        String code = generate(String.join("\n",
                "indicator(\"Quotes\")",
                "caption = input.string(\"say \\\"hi\\\"\", \"Label\")")).code();
        assertContains(code, "  caption: \"say \\\"hi\\\"\",");
        assertContains(code, "defval: \"say \\\"hi\\\"\"");
    }
}
