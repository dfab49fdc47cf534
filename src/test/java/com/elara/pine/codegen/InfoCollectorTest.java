package com.elara.pine.codegen;

import com.elara.pine.parser.ParseResult;
import com.elara.pine.parser.Parser;
import com.elara.pine.parser.Statement.Stmt;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InfoCollectorTest {

    private static List<Stmt> parse(String src) {
        ParseResult r = Parser.parseSource(src);
        assertFalse(r.hasErrors(), () -> "syntax errors: " + r.errors());
        return r.statements();
    }

    @Test
    void seriesMembership_propagatesThroughBindings() {
        GeneratorContext ctx = new InfoCollector().collect(parse(String.join("\n",
                "indicator(\"Spread\")",
                "a = close",
                "b = a * 2",
                "c = 3",
                "d = ta.sma(c, 5)")));
        assertTrue(ctx.isSeriesName("a"));
        assertTrue(ctx.isSeriesName("b"));
        assertFalse(ctx.isSeriesName("c"));
        assertTrue(ctx.isSeriesName("d"));
        assertEquals("Spread", ctx.title());
        assertEquals("Spread", ctx.shortTitle());
    }

    @Test
    void reassignedAndRecursiveNames_areSeparated() {
        GeneratorContext ctx = new InfoCollector().collect(parse(String.join("\n",
                "counter = 0",
                "counter := counter + 1",
                "acc = 0.0",
                "acc := nz(acc[1]) + close")));
        assertTrue(ctx.isReassigned("counter"));
        assertFalse(ctx.isRecursive("counter"));
        assertTrue(ctx.isReassigned("acc"));
        assertTrue(ctx.isRecursive("acc"));
        assertTrue(ctx.isSeriesName("acc"));
    }

    @Test
    void calendarAndEnvironmentUsage_isDetected() {
        GeneratorContext ctx = new InfoCollector().collect(parse(String.join("\n",
                "h = hour",
                "t = syminfo.ticker",
                "last = bar_index == last_bar_index")));
        assertTrue(ctx.timeSeries().contains("hour"));
        assertTrue(ctx.usesSyminfo());
        assertFalse(ctx.usesTimeframe());
        assertTrue(ctx.usesBarIndex());
    }

    @Test
    void collector_isSingleUse() {
        InfoCollector collector = new InfoCollector();
        List<Stmt> stmts = parse("x = 1");
        collector.collect(stmts);
        assertThrows(IllegalStateException.class, () -> collector.collect(stmts));
    }
}
