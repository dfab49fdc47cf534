package com.elara.pine;

import com.elara.debug.Debug;
import com.elara.pine.runtime.BarData;
import com.elara.pine.runtime.Series;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PineTranspilerTest {

    private static final ObjectMapper om = new ObjectMapper();

    private static final String BOP = String.join("\n",
            "//@version=5",
            "indicator(\"Balance of Power\", format=format.price, precision=2)",
            "bop = (close - open) / (high - low)",
            "plot(bop, color=color.red, title=\"BOP\")");

    @Test
    void validSource_producesCodeWithoutErrors() {
        TranspileResult r = new PineTranspiler().transpileWithResult(BOP);
        assertTrue(r.isSuccess(), () -> "errors: " + r.getErrors());
        assertTrue(r.getCode().contains("export function Balance_of_Power(bars: any[]): IndicatorResult {"));
        assertTrue(r.getWarnings().isEmpty());
    }

    @Test
    void transpile_returnsCodeDirectly() {
        String code = new PineTranspiler().transpile(BOP);
        assertTrue(code.contains("close.sub(open).div(high.sub(low))"));
    }

    @Test
    void syntaxErrors_stopBeforeAnalysis() {
        TranspileResult r = new PineTranspiler().transpileWithResult("a = 1\nx = \"unterminated");
        assertFalse(r.isSuccess());
        assertEquals("", r.getCode());
        assertFalse(r.getErrors().isEmpty());
        assertTrue(r.getWarnings().isEmpty());
    }

    @Test
    void semanticErrors_skipGeneration_shadowingStaysSilent() {
        String src = String.join("\n",
                "a = 1",
                "if close > open",
                "    a = 2",
                "b := 3");
        TranspileResult r = new PineTranspiler().transpileWithResult(src);
        assertFalse(r.isSuccess());
        assertEquals("", r.getCode());
        assertEquals(1, r.getErrors().size());
        assertEquals("Variable 'b' is not defined", r.getErrors().get(0).getMessage());
        assertEquals(4, r.getErrors().get(0).getLine());
        assertTrue(r.getWarnings().isEmpty());
    }

    @Test
    void transpile_throwsWithEveryErrorListed() {
        String src = String.join("\n",
                "x := 1",
                "break",
                "y := 2");
        TranspileException ex = assertThrows(TranspileException.class,
                () -> new PineTranspiler().transpile(src));
        assertEquals(3, ex.getErrors().size());
        assertTrue(ex.getMessage().startsWith("Transpile errors:\nLine 1: "), ex.getMessage());
        assertTrue(ex.getMessage().contains("\nLine 3: "));
    }

    @Test
    void generatorWarnings_followSemanticWarnings() {
        String src = String.join("\n",
                "indicator(\"Levels\")",
                "hline(50, \"Mid\")",
                "plot(close)");
        TranspileResult r = new PineTranspiler().transpileWithResult(src);
        assertTrue(r.isSuccess());
        assertEquals(1, r.getWarnings().size());
        assertEquals(2, r.getWarnings().get(0).getLine());
        assertTrue(r.getWarnings().get(0).getMessage().contains("hline"));
    }

    @Test
    void options_areAppliedToGeneration() {
        PineTranspiler t = new PineTranspiler(new TranspileOptions().setIncludeImports(false));
        assertTrue(t.transpile(BOP).startsWith("export function"));

        t.setOptions(new TranspileOptions().setRuntimeModule("./runtime"));
        assertTrue(t.transpile(BOP).contains("from './runtime';"));

        t.setOptions(null);
        assertEquals("oakscriptjs", t.getOptions().getRuntimeModule());
    }

    @Test
    void nullSource_isTreatedAsEmpty() {
        TranspileResult r = new PineTranspiler().transpileWithResult(null);
        assertTrue(r.isSuccess());
        assertTrue(r.getCode().contains("export function Indicator(bars: any[])"));
    }

    @Test
    void resultJson_listsDiagnostics() throws Exception {
        TranspileResult r = new PineTranspiler().transpileWithResult("x := 1");
        JsonNode root = om.readTree(r.toJson());
        assertEquals("", root.path("code").asText());
        assertEquals(1, root.path("errors").size());
        assertEquals(1, root.path("errors").get(0).path("line").asInt());
        assertTrue(root.path("errors").get(0).path("message").asText().contains("'x'"));
        assertTrue(root.path("warnings").isArray());
    }

    @Test
    void optionsJson_fillsDefaults() throws Exception {
        TranspileOptions o = TranspileOptions.fromJson("{\"includeImports\": false}");
        assertFalse(o.isIncludeImports());
        assertEquals("oakscriptjs", o.getRuntimeModule());
        assertEquals("./libs", o.getLibraryPath());
        assertThrows(java.io.IOException.class, () -> TranspileOptions.fromJson("[1]"));
    }

    @Test
    void pipelineAndRuntime_runWithTheDefaultDebugSink() throws Exception {
        // no sink is installed here: the default must be the silent one
        assertNotNull(Debug.get().getSink());
        assertTrue(new PineTranspiler().transpileWithResult(BOP).isSuccess());

        BarData data = BarData.fromJson("[{\"time\": 1, \"open\": 1, \"high\": 3, \"low\": 0, \"close\": 2}]");
        assertEquals(3.0, Series.fromBars(data, "close").add(1).get(0), 0.0);
    }
}
