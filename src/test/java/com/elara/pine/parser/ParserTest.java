package com.elara.pine.parser;

import com.elara.pine.parser.Statement.Stmt;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static List<Stmt> parseOk(String src) {
        ParseResult r = Parser.parseSource(src);
        assertFalse(r.hasErrors(), () -> "unexpected syntax errors: " + r.errors());
        return r.statements();
    }

    @Test
    void declaration_withBinaryPrecedence() {
        List<Stmt> stmts = parseOk("bop = (close - open) / (high - low)");
        assertEquals(1, stmts.size());
        Statement.Declaration d = (Statement.Declaration) stmts.get(0);
        assertEquals("bop", d.name);
        Expr.Binary div = (Expr.Binary) d.initializer;
        assertEquals("/", div.operator);
        assertEquals("-", ((Expr.Binary) div.left).operator);
        assertEquals("-", ((Expr.Binary) div.right).operator);
    }

    @Test
    void indicatorHeader_keepsNamedArguments() {
        List<Stmt> stmts = parseOk("indicator(\"My RSI\", shorttitle=\"RSI\", overlay=false)");
        Statement.IndicatorDeclaration h = (Statement.IndicatorDeclaration) stmts.get(0);
        assertEquals(3, h.args.size());
        assertFalse(h.args.get(0).isNamed());
        assertEquals("shorttitle", h.args.get(1).name);
    }

    @Test
    void forRange_withStepAndBraceBlock() {
        List<Stmt> stmts = parseOk(String.join("\n",
                "sum = 0",
                "for i = 0 to 10 by 2 { sum := sum + i }"));
        Statement.ForRange loop = (Statement.ForRange) stmts.get(1);
        assertEquals("i", loop.variable);
        assertEquals(2.0, ((Expr.NumberLiteral) loop.step).value, 0.0);
        assertEquals(1, loop.body.statements.size());
        Statement.Reassignment r = (Statement.Reassignment) loop.body.statements.get(0);
        assertEquals("sum", r.targetName());
        assertNull(r.compoundOperator);
    }

    @Test
    void compoundAssignment_becomesReassignmentWithBinaryValue() {
        List<Stmt> stmts = parseOk(String.join("\n",
                "a = 1",
                "a += 2"));
        Statement.Reassignment r = (Statement.Reassignment) stmts.get(1);
        assertEquals("+", r.compoundOperator);
        Expr.Binary value = (Expr.Binary) r.value;
        assertEquals("a", ((Expr.Identifier) value.left).name);
    }

    @Test
    void ifElseIfElse_chain() {
        List<Stmt> stmts = parseOk(String.join("\n",
                "x = 0",
                "if close > open",
                "    x := 1",
                "else if close < open",
                "    x := -1",
                "else",
                "    x := 0"));
        Statement.If first = (Statement.If) stmts.get(1);
        Statement.If second = (Statement.If) first.elseBranch;
        assertTrue(second.elseBranch instanceof Statement.Block);
    }

    @Test
    void historyAccess_andTupleDestructuring() {
        List<Stmt> stmts = parseOk(String.join("\n",
                "prev = close[1]",
                "[m, s, h] = ta.macd(close, 12, 26, 9)"));
        Statement.Declaration d = (Statement.Declaration) stmts.get(0);
        assertTrue(d.initializer instanceof Expr.HistoryAccess);
        Statement.TupleDestructuring t = (Statement.TupleDestructuring) stmts.get(1);
        assertEquals(Arrays.asList("m", "s", "h"), t.names);
        assertEquals("ta.macd", ((Expr.Call) t.initializer).callee);
    }

    @Test
    void switchWithoutSubject_hasDefaultArm() {
        List<Stmt> stmts = parseOk(String.join("\n",
                "x = switch",
                "    close > open => 1",
                "    => 0",
                "y = x"));
        Expr.Switch sw = (Expr.Switch) ((Statement.Declaration) stmts.get(0)).initializer;
        assertNull(sw.subject);
        assertEquals(2, sw.arms.size());
        assertTrue(sw.arms.get(1).isDefault());
        assertEquals(2, stmts.size());
    }

    @Test
    void functionDeclaration_expressionBody_withDefault() {
        List<Stmt> stmts = parseOk("f(a, b = 2) => a + b");
        Statement.FunctionDeclaration fn = (Statement.FunctionDeclaration) stmts.get(0);
        assertTrue(fn.expressionBody);
        assertEquals(2, fn.params.size());
        assertFalse(fn.params.get(0).isOptional());
        assertTrue(fn.params.get(1).isOptional());
    }

    @Test
    void userType_andInstantiation() {
        List<Stmt> stmts = parseOk(String.join("\n",
                "type Point",
                "    float x = 0.0",
                "    float y",
                "p = Point.new(1.0, 2.0)"));
        Statement.TypeDeclaration type = (Statement.TypeDeclaration) stmts.get(0);
        assertEquals("Point", type.name);
        assertEquals(2, type.fields.size());
        assertNull(type.fields.get(1).defaultValue);
        Statement.Declaration p = (Statement.Declaration) stmts.get(1);
        assertTrue(p.initializer instanceof Expr.TypeInstantiation);
    }

    @Test
    void genericArrayConstructor_keepsCalleeAndTypeArguments() {
        List<Stmt> stmts = parseOk("arr = array.new<float>(3, 0.0)");
        Expr.Call call = (Expr.Call) ((Statement.Declaration) stmts.get(0)).initializer;
        assertEquals("array.new", call.callee);
        assertTrue(call.isGeneric());
        assertEquals(Arrays.asList("float"), call.typeArgs);
    }

    @Test
    void importWithAlias() {
        List<Stmt> stmts = parseOk("import TradingView/ta/7 as tv");
        Statement.ImportStatement imp = (Statement.ImportStatement) stmts.get(0);
        assertEquals("TradingView", imp.publisher);
        assertEquals("ta", imp.library);
        assertEquals(7, imp.version);
        assertEquals("tv", imp.alias);
    }

    @Test
    void syntaxErrors_areCollected_andParsingResumes() {
        ParseResult r = Parser.parseSource(String.join("\n",
                "x = )",
                "y = 1",
                "w = * 2"));
        assertEquals(2, r.errors().size());
        assertEquals(1, r.errors().get(0).line);
        assertEquals(3, r.errors().get(1).line);
        boolean hasY = false;
        for (Stmt s : r.statements()) {
            if (s instanceof Statement.Declaration && "y".equals(((Statement.Declaration) s).name)) hasY = true;
        }
        assertTrue(hasY);
    }

    private static String nested(int levels, String open, String inner, String close) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < levels; i++) sb.append(open);
        sb.append(inner);
        for (int i = 0; i < levels; i++) sb.append(close);
        return sb.toString();
    }

    @Test
    void deeplyNestedParentheses_areReportedAndParsingContinues() {
        String src = "x = " + nested(20000, "(", "1", ")") + "\ny = 2";
        ParseResult r = Parser.parseSource(src);
        assertEquals(1, r.errors().size(), () -> "errors: " + r.errors());
        assertEquals("Expression nested too deeply", r.errors().get(0).message);
        assertEquals(1, r.errors().get(0).line);
        boolean hasY = false;
        for (Stmt s : r.statements()) {
            if (s instanceof Statement.Declaration && "y".equals(((Statement.Declaration) s).name)) hasY = true;
        }
        assertTrue(hasY);
    }

    @Test
    void deeplyNestedUnaryOperators_areReported() {
        ParseResult r = Parser.parseSource("x = " + nested(20000, "- ", "1", ""));
        assertTrue(r.hasErrors());
        assertEquals("Expression nested too deeply", r.errors().get(0).message);
    }

    @Test
    void moderateNesting_isAccepted() {
        List<Stmt> stmts = parseOk("x = " + nested(100, "(", "close", ")"));
        Statement.Declaration d = (Statement.Declaration) stmts.get(0);
        assertTrue(d.initializer instanceof Expr.Identifier, () -> "unexpected node: " + d.initializer);
    }
}
