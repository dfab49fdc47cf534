package com.elara.pine.semantic;

import com.elara.pine.parser.ParseResult;
import com.elara.pine.parser.Parser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SemanticAnalyzerTest {

    private static AnalysisResult analyze(String src) {
        ParseResult parsed = Parser.parseSource(src);
        assertFalse(parsed.hasErrors(), () -> "syntax errors: " + parsed.errors());
        return new SemanticAnalyzer(src).analyze(parsed.statements());
    }

    private static boolean hasError(AnalysisResult r, SemanticErrorKind kind) {
        for (SemanticError e : r.errors()) {
            if (e.kind() == kind) return true;
        }
        return false;
    }

    @Test
    void breakAndContinue_outsideLoop_areErrors() {
        AnalysisResult r = analyze(String.join("\n",
                "x = 1",
                "break",
                "continue"));
        assertFalse(r.isValid());
        assertTrue(hasError(r, SemanticErrorKind.BREAK_OUTSIDE_LOOP));
        assertTrue(hasError(r, SemanticErrorKind.CONTINUE_OUTSIDE_LOOP));
        assertEquals(2, r.errors().get(0).line());
    }

    @Test
    void breakInsideIfInsideLoop_isAccepted() {
        AnalysisResult r = analyze(String.join("\n",
                "for i = 0 to 5",
                "    if i > 2",
                "        break",
                "    continue"));
        assertTrue(r.isValid(), () -> "unexpected errors: " + r.errors());
    }

    @Test
    void duplicateInSameScope_isError_butShadowingIsSilent() {
        AnalysisResult dup = analyze(String.join("\n",
                "a = 1",
                "a = 2"));
        assertTrue(hasError(dup, SemanticErrorKind.DUPLICATE_DECLARATION));

        String nested = String.join("\n",
                "a = 1",
                "if close > open",
                "    a = 2");
        AnalysisResult shadow = analyze(nested);
        assertTrue(shadow.isValid(), () -> "unexpected errors: " + shadow.errors());
        assertTrue(shadow.warnings().isEmpty());

        ParseResult parsed = Parser.parseSource(nested);
        AnalysisResult reported = new SemanticAnalyzer(nested).setReportShadowing(true).analyze(parsed.statements());
        assertTrue(reported.isValid());
        assertEquals(1, reported.warnings().size());
        assertTrue(reported.warnings().get(0).message().contains("shadows a declaration at line 1"));
        assertEquals(3, reported.warnings().get(0).line());
    }

    @Test
    void builtinArity_isChecked() {
        assertTrue(hasError(analyze("x = ta.sma(close)"), SemanticErrorKind.WRONG_ARGUMENT_COUNT));
        assertTrue(hasError(analyze("x = ta.sma(close, 14, 2)"), SemanticErrorKind.WRONG_ARGUMENT_COUNT));
        assertTrue(analyze("x = ta.sma(close, 14)").isValid());
        // named options count toward the optional budget
        assertTrue(analyze("plot(close, title=\"C\", color=color.red, linewidth=2)").isValid());
    }

    @Test
    void unknownFunctions_areAccepted() {
        assertTrue(analyze("x = customScore(close, 3)").isValid());
    }

    @Test
    void undefinedVariable_isReported_withContextLine() {
        AnalysisResult r = analyze(String.join("\n",
                "x = 1",
                "y = foo + 1"));
        assertTrue(hasError(r, SemanticErrorKind.UNDEFINED_VARIABLE));
        SemanticError e = r.errors().get(0);
        assertEquals("y = foo + 1", e.context());
        String formatted = e.format();
        assertTrue(formatted.startsWith("Semantic Error [UNDEFINED_VARIABLE] at line 2"), formatted);
        assertTrue(formatted.contains("Variable 'foo' is not defined"));
        assertTrue(formatted.contains("2 | y = foo + 1"));
    }

    @Test
    void reassigningBuiltinSeries_isError_butUserNamesMayBeRebound() {
        assertTrue(hasError(analyze("close := 1"), SemanticErrorKind.CONST_REASSIGNMENT));
        assertTrue(hasError(analyze("zz := 1"), SemanticErrorKind.UNDEFINED_VARIABLE));
        assertTrue(analyze(String.join("\n",
                "a = 1",
                "a := 2",
                "a += 3")).isValid());
    }

    @Test
    void allErrorsAreCollectedInOnePass() {
        AnalysisResult r = analyze(String.join("\n",
                "a = foo",
                "b = bar",
                "break"));
        assertEquals(3, r.errors().size());
    }

    @Test
    void inputsAndFunctionsAreDeclared() {
        AnalysisResult r = analyze(String.join("\n",
                "len = input.int(14, \"Length\")",
                "f(x) => x * 2",
                "y = f(len)"));
        assertTrue(r.isValid(), () -> "unexpected errors: " + r.errors());
        Symbol f = r.symbolTable().lookup("f");
        assertEquals(SymbolKind.FUNCTION, f.kind());
        assertEquals(SymbolKind.PARAMETER, r.symbolTable().lookup("len").kind());
    }

    @Test
    void typeInference_marksSeriesExpressions() {
        AnalysisResult r = analyze(String.join("\n",
                "a = close - open",
                "b = 1 + 2",
                "c = 1.5 * 2"));
        SymbolTable t = r.symbolTable();
        assertTrue(t.lookup("a").isSeries());
        assertEquals(PineType.INT, t.lookup("b").type());
        assertEquals(PineType.FLOAT, t.lookup("c").type());
    }
}
