package com.elara.pine.codegen;

import java.util.ArrayList;
import java.util.List;

import com.elara.pine.parser.Expr;
import com.elara.pine.parser.Expr.ExprInterface;
import com.elara.pine.parser.Statement;
import com.elara.pine.parser.Statement.Stmt;

/** Second-pass emitter for statements. Declarative statements were consumed by the collector. */
public class StatementGenerator implements Statement.StmtVisitor {

    private final GeneratorContext ctx;
    private final EmissionState state;
    private final CodeWriter out;
    private final ExpressionGenerator exprs;
    private final FunctionGenerator functions;

    public StatementGenerator(GeneratorContext ctx, EmissionState state, CodeWriter out, ExpressionGenerator exprs) {
        this.ctx = ctx;
        this.state = state;
        this.out = out;
        this.exprs = exprs;
        this.functions = new FunctionGenerator(ctx, state, out, exprs, this);
    }

    public FunctionGenerator functions() {
        return functions;
    }

    public void emitAll(List<Stmt> statements) {
        for (Stmt s : statements) {
            s.accept(this);
        }
    }

    /** Emits a nested block with its own set of declared names. */
    void emitBlock(Stmt body) {
        out.indent();
        state.enterBlock();
        if (body instanceof Statement.Block) {
            emitAll(((Statement.Block) body).statements);
        } else if (body != null) {
            body.accept(this);
        }
        state.exitBlock();
        out.dedent();
    }

    private static boolean isInputCall(ExprInterface expr) {
        return expr instanceof Expr.Call && InputType.isInputCall(((Expr.Call) expr).callee);
    }

    // -------------------------
    // Bindings
    // -------------------------

    @Override
    public void visitDeclaration(Statement.Declaration stmt) {
        ExprInterface init = stmt.initializer;
        if (isInputCall(init)) return;

        String name = Identifiers.sanitize(stmt.name);
        if (init == null) {
            if (state.declare(name)) out.line("let " + name + ";");
            return;
        }

        int plotIndex = state.nextPlotIndex();
        String value = exprs.generate(init);
        if (state.nextPlotIndex() > plotIndex) {
            state.recordPlotVariable(name, "plot" + plotIndex);
        }
        if (value.trim().isEmpty()) {
            out.line("// " + name + " = <unsupported>;");
            return;
        }
        if (ctx.isReassigned(stmt.name) && (init instanceof Expr.NumberLiteral
                || (SeriesClassifier.isNa(init) && ctx.isSeriesName(name)))) {
            value = ExpressionGenerator.constantSeries(value);
        }
        if (!state.declare(name)) {
            out.line(name + " = " + value + ";");
            return;
        }
        String keyword = ctx.isReassigned(stmt.name) ? "let" : "const";
        out.line(keyword + " " + name + " = " + value + ";");
    }

    @Override
    public void visitReassignment(Statement.Reassignment stmt) {
        String name = stmt.targetName();
        if (name != null && ctx.isRecursive(name)) {
            emitRecurrence(name, stmt.value);
            return;
        }
        out.line(exprs.generate(stmt.target) + " = " + exprs.generate(stmt.value) + ";");
    }

    /** A value that depends on its own previous bar is computed bar by bar into a plain array. */
    private void emitRecurrence(String name, ExprInterface value) {
        String target = IdentifierMapper.translate(name, ctx.variables());
        String values = target + "Values";
        String prev = target + "Prev";

        out.line("// Recursive formula for " + name);
        if (state.declare(values)) {
            out.line("const " + values + ": number[] = new Array(bars.length).fill(NaN);");
        } else {
            out.line(values + ".fill(NaN);");
        }
        out.line("for (let i = 0; i < bars.length; i++) {");
        out.indent();
        out.line("const " + prev + " = i > 0 ? " + values + "[i - 1] : NaN;");
        out.line(values + "[i] = " + exprs.recurrence(value, name, prev) + ";");
        out.dedent();
        out.line("}");
        out.line(target + " = Series.fromArray(bars, " + values + ");");
    }

    @Override
    public void visitTupleDestructuring(Statement.TupleDestructuring stmt) {
        List<String> names = new ArrayList<>();
        for (String n : stmt.names) {
            String name = Identifiers.sanitize(n);
            state.declare(name);
            names.add(name);
        }
        out.line("const [" + String.join(", ", names) + "] = " + exprs.generate(stmt.initializer) + ";");
    }

    @Override
    public void visitExprStmt(Statement.ExprStmt stmt) {
        if (isInputCall(stmt.expression)) return;
        String text = exprs.generate(stmt.expression);
        if (!text.isEmpty()) {
            out.line(text + ";");
        }
    }

    // -------------------------
    // Control flow
    // -------------------------

    @Override
    public void visitBlock(Statement.Block stmt) {
        out.line("{");
        emitBlock(stmt);
        out.line("}");
    }

    @Override
    public void visitIf(Statement.If stmt) {
        out.line("if (" + exprs.generate(stmt.condition) + ") {");
        emitBlock(stmt.thenBranch);
        Stmt alternate = stmt.elseBranch;
        while (alternate instanceof Statement.If) {
            Statement.If elseIf = (Statement.If) alternate;
            out.line("} else if (" + exprs.generate(elseIf.condition) + ") {");
            emitBlock(elseIf.thenBranch);
            alternate = elseIf.elseBranch;
        }
        if (alternate != null) {
            out.line("} else {");
            emitBlock(alternate);
        }
        out.line("}");
    }

    @Override
    public void visitForRange(Statement.ForRange stmt) {
        String v = Identifiers.sanitize(stmt.variable);
        String start = exprs.generate(stmt.start);
        String end = exprs.generate(stmt.end);
        String step = stmt.step != null ? exprs.generate(stmt.step) : "1";
        out.line("for (let " + v + " = " + start + "; " + v + " <= " + end + "; " + v + " += " + step + ") {");
        emitBlock(stmt.body);
        out.line("}");
    }

    @Override
    public void visitForIn(Statement.ForIn stmt) {
        String iterable = exprs.generate(stmt.iterable);
        String item = Identifiers.sanitize(stmt.itemVariable);
        if (stmt.indexVariable != null) {
            String index = Identifiers.sanitize(stmt.indexVariable);
            out.line("for (const [" + index + ", " + item + "] of " + iterable + ".entries()) {");
        } else {
            out.line("for (const " + item + " of " + iterable + ") {");
        }
        emitBlock(stmt.body);
        out.line("}");
    }

    @Override
    public void visitWhile(Statement.While stmt) {
        out.line("while (" + exprs.generate(stmt.condition) + ") {");
        emitBlock(stmt.body);
        out.line("}");
    }

    @Override
    public void visitBreak(Statement.Break stmt) {
        out.line("break;");
    }

    @Override
    public void visitContinue(Statement.Continue stmt) {
        out.line("continue;");
    }

    @Override
    public void visitComment(Statement.Comment stmt) {
        out.line("// " + stmt.text);
    }

    // -------------------------
    // Declarations
    // -------------------------

    @Override
    public void visitFunctionDeclaration(Statement.FunctionDeclaration stmt) {
        functions.emitFunction(stmt);
    }

    // Consumed by the collector; types and methods are emitted ahead of the body.
    @Override public void visitTypeDeclaration(Statement.TypeDeclaration stmt) {}
    @Override public void visitMethodDeclaration(Statement.MethodDeclaration stmt) {}
    @Override public void visitImport(Statement.ImportStatement stmt) {}
    @Override public void visitIndicatorDeclaration(Statement.IndicatorDeclaration stmt) {}
    @Override public void visitLibraryDeclaration(Statement.LibraryDeclaration stmt) {}
}
