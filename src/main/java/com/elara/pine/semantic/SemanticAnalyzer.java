package com.elara.pine.semantic;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.elara.debug.Debug;
import com.elara.pine.parser.Expr;
import com.elara.pine.parser.Expr.ExprInterface;
import com.elara.pine.parser.Statement;
import com.elara.pine.parser.Statement.Stmt;

/**
 * Walks the syntax tree with nested scopes, resolving names and checking call arity.
 *
 * Analysis is deliberately lenient where the language is: unknown functions are accepted,
 * a plain assignment may rebind a name with {@code :=} later, and only the builtin price and
 * time series are protected from reassignment.
 */
public class SemanticAnalyzer implements Statement.StmtVisitor, Expr.ExprVisitor<Void> {
    private static final String TAG = "SemanticAnalyzer";

    private final String[] sourceLines;
    private final Set<String> protectedNames = new HashSet<>(BuiltinSymbols.PROTECTED);

    private SymbolTable symbols;
    private TypeChecker types;
    private List<SemanticError> errors;
    private List<SemanticWarning> warnings;
    private boolean reportShadowing;

    public SemanticAnalyzer() {
        this(null);
    }

    /** @param source original text, used to attach the offending line to diagnostics; may be null */
    public SemanticAnalyzer(String source) {
        this.sourceLines = source == null ? null : source.split("\n", -1);
    }

    /**
     * Shadowing an outer declaration from a nested scope is legal. When enabled it is
     * reported as a warning; off by default.
     */
    public SemanticAnalyzer setReportShadowing(boolean reportShadowing) {
        this.reportShadowing = reportShadowing;
        return this;
    }

    public AnalysisResult analyze(List<Stmt> program) {
        symbols = new SymbolTable();
        types = new TypeChecker(symbols);
        errors = new ArrayList<>();
        warnings = new ArrayList<>();

        BuiltinSymbols.declareAll(symbols);
        for (Stmt stmt : program) {
            stmt.accept(this);
        }

        Debug.get().d(TAG, "errors=" + errors.size() + " warnings=" + warnings.size()
                + " symbols=" + symbols.allSymbols().size());
        return new AnalysisResult(errors, warnings, symbols);
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public void visitExprStmt(Statement.ExprStmt stmt) {
        visit(stmt.expression);
    }

    @Override
    public void visitDeclaration(Statement.Declaration stmt) {
        String name = stmt.name;
        if (symbols.isInCurrentScope(name)) {
            error(SemanticErrorKind.DUPLICATE_DECLARATION,
                    "Variable '" + name + "' is already declared in this scope", stmt.line, stmt.column);
            return;
        }

        if (isInputCall(stmt.initializer)) {
            symbols.declare(new Symbol(name, SymbolKind.PARAMETER, PineType.UNKNOWN, true, false, stmt.line, stmt.column));
            return;
        }

        warnIfShadowing(name, stmt.line, stmt.column);

        PineType type = types.inferType(stmt.initializer);
        if (type.kind() == PineType.Kind.UNKNOWN && stmt.typeName != null) {
            type = PineType.fromName(stmt.typeName);
        }
        symbols.declare(new Symbol(name, SymbolKind.VARIABLE, type, true, stmt.qualifier != Statement.Qualifier.NONE,
                stmt.line, stmt.column));
        visit(stmt.initializer);
    }

    @Override
    public void visitReassignment(Statement.Reassignment stmt) {
        String name = stmt.targetName();
        if (name != null) {
            Symbol symbol = symbols.lookup(name);
            if (symbol == null) {
                error(SemanticErrorKind.UNDEFINED_VARIABLE,
                        "Variable '" + name + "' is not defined", stmt.line, stmt.column);
                return;
            }
            if (protectedNames.contains(name)) {
                error(SemanticErrorKind.CONST_REASSIGNMENT,
                        "Cannot reassign built-in constant '" + name + "'", stmt.line, stmt.column);
                return;
            }
        }
        visit(stmt.target);
        visit(stmt.value);
    }

    @Override
    public void visitBlock(Statement.Block stmt) {
        for (Stmt s : stmt.statements) {
            s.accept(this);
        }
    }

    @Override
    public void visitIf(Statement.If stmt) {
        visit(stmt.condition);
        inScope(ScopeKind.BLOCK, stmt.thenBranch);
        if (stmt.elseBranch instanceof Statement.If) {
            stmt.elseBranch.accept(this);
        } else if (stmt.elseBranch != null) {
            inScope(ScopeKind.BLOCK, stmt.elseBranch);
        }
    }

    @Override
    public void visitForRange(Statement.ForRange stmt) {
        symbols.enterScope(ScopeKind.LOOP);
        symbols.declare(new Symbol(stmt.variable, SymbolKind.VARIABLE, PineType.INT, false, true, stmt.line, stmt.column));
        visit(stmt.start);
        visit(stmt.end);
        visit(stmt.step);
        stmt.body.accept(this);
        symbols.exitScope();
    }

    @Override
    public void visitForIn(Statement.ForIn stmt) {
        symbols.enterScope(ScopeKind.LOOP);
        visit(stmt.iterable);
        if (stmt.indexVariable != null) {
            symbols.declare(new Symbol(stmt.indexVariable, SymbolKind.VARIABLE, PineType.INT, false, true, stmt.line, stmt.column));
        }
        symbols.declare(new Symbol(stmt.itemVariable, SymbolKind.VARIABLE, PineType.UNKNOWN, false, true, stmt.line, stmt.column));
        stmt.body.accept(this);
        symbols.exitScope();
    }

    @Override
    public void visitWhile(Statement.While stmt) {
        symbols.enterScope(ScopeKind.LOOP);
        visit(stmt.condition);
        stmt.body.accept(this);
        symbols.exitScope();
    }

    @Override
    public void visitTupleDestructuring(Statement.TupleDestructuring stmt) {
        visit(stmt.initializer);
        for (String name : stmt.names) {
            if (symbols.isInCurrentScope(name)) {
                error(SemanticErrorKind.DUPLICATE_DECLARATION,
                        "Variable '" + name + "' is already declared in this scope", stmt.line, stmt.column);
                continue;
            }
            symbols.declare(new Symbol(name, SymbolKind.VARIABLE, PineType.UNKNOWN, true, false, stmt.line, stmt.column));
        }
    }

    @Override
    public void visitBreak(Statement.Break stmt) {
        if (!symbols.isInsideLoop()) {
            error(SemanticErrorKind.BREAK_OUTSIDE_LOOP, "break statement must be inside a loop", stmt.line, stmt.column);
        }
    }

    @Override
    public void visitContinue(Statement.Continue stmt) {
        if (!symbols.isInsideLoop()) {
            error(SemanticErrorKind.CONTINUE_OUTSIDE_LOOP, "continue statement must be inside a loop", stmt.line, stmt.column);
        }
    }

    @Override
    public void visitComment(Statement.Comment stmt) {
    }

    @Override
    public void visitFunctionDeclaration(Statement.FunctionDeclaration stmt) {
        if (symbols.isInCurrentScope(stmt.name)) {
            error(SemanticErrorKind.DUPLICATE_DECLARATION,
                    "Function '" + stmt.name + "' is already declared in this scope", stmt.line, stmt.column);
            return;
        }

        List<FunctionParam> params = new ArrayList<>();
        for (Statement.Parameter p : stmt.params) {
            params.add(new FunctionParam(p.name, PineType.fromName(p.typeName), p.isOptional()));
        }
        symbols.declare(new Symbol(stmt.name, SymbolKind.FUNCTION, PineType.function(params, PineType.UNKNOWN),
                true, false, stmt.line, stmt.column));

        symbols.enterScope(ScopeKind.FUNCTION);
        for (Statement.Parameter p : stmt.params) {
            visit(p.defaultValue);
            symbols.declare(new Symbol(p.name, SymbolKind.PARAMETER, PineType.fromName(p.typeName), false, true,
                    stmt.line, stmt.column));
        }
        stmt.body.accept(this);
        symbols.exitScope();
    }

    @Override
    public void visitTypeDeclaration(Statement.TypeDeclaration stmt) {
        if (!symbols.isInCurrentScope(stmt.name)) {
            symbols.declare(new Symbol(stmt.name, SymbolKind.TYPE, PineType.userDefined(stmt.name), true, false,
                    stmt.line, stmt.column));
        }
    }

    @Override
    public void visitMethodDeclaration(Statement.MethodDeclaration stmt) {
        // bodies run against fields of the bound type, which are not modelled here
    }

    @Override
    public void visitImport(Statement.ImportStatement stmt) {
        if (!symbols.isInCurrentScope(stmt.alias)) {
            symbols.declare(new Symbol(stmt.alias, SymbolKind.VARIABLE, PineType.UNKNOWN, true, false,
                    stmt.line, stmt.column));
        }
    }

    @Override
    public void visitIndicatorDeclaration(Statement.IndicatorDeclaration stmt) {
    }

    @Override
    public void visitLibraryDeclaration(Statement.LibraryDeclaration stmt) {
    }

    // -------------------------
    // Expressions
    // -------------------------

    private void visit(ExprInterface expr) {
        if (expr != null) expr.accept(this);
    }

    private void visitArgs(List<Expr.Argument> args) {
        for (Expr.Argument a : args) {
            visit(a.value);
        }
    }

    @Override
    public Void visitNumberLiteral(Expr.NumberLiteral expr) {
        return null;
    }

    @Override
    public Void visitStringLiteral(Expr.StringLiteral expr) {
        return null;
    }

    @Override
    public Void visitIdentifier(Expr.Identifier expr) {
        if ("na".equals(expr.name)) return null;
        if (symbols.lookup(expr.name) == null) {
            error(SemanticErrorKind.UNDEFINED_VARIABLE,
                    "Variable '" + expr.name + "' is not defined", expr.line, expr.column);
        }
        return null;
    }

    @Override
    public Void visitMember(Expr.Member expr) {
        // namespace constants and fields of user values are not tracked
        return null;
    }

    @Override
    public Void visitFieldAccess(Expr.FieldAccess expr) {
        visit(expr.object);
        return null;
    }

    @Override
    public Void visitCall(Expr.Call expr) {
        String callee = expr.callee;
        if (isInputName(callee)) return null;

        Symbol symbol = symbols.lookup(callee);
        if (!expr.isGeneric() && symbol != null && symbol.type().kind() == PineType.Kind.FUNCTION) {
            checkArity(callee, symbol.type().params(), expr.args.size(), expr.line, expr.column);
        }
        visitArgs(expr.args);
        return null;
    }

    @Override
    public Void visitMethodCall(Expr.MethodCall expr) {
        visit(expr.receiver);
        visitArgs(expr.args);
        return null;
    }

    @Override
    public Void visitTypeInstantiation(Expr.TypeInstantiation expr) {
        visitArgs(expr.args);
        return null;
    }

    @Override
    public Void visitBinary(Expr.Binary expr) {
        visit(expr.left);
        visit(expr.right);
        return null;
    }

    @Override
    public Void visitUnary(Expr.Unary expr) {
        visit(expr.operand);
        return null;
    }

    @Override
    public Void visitTernary(Expr.Ternary expr) {
        visit(expr.condition);
        visit(expr.thenBranch);
        visit(expr.elseBranch);
        return null;
    }

    @Override
    public Void visitHistoryAccess(Expr.HistoryAccess expr) {
        visit(expr.base);
        visit(expr.offset);
        return null;
    }

    @Override
    public Void visitSwitch(Expr.Switch expr) {
        visit(expr.subject);
        for (Expr.SwitchArm arm : expr.arms) {
            visit(arm.match);
            visit(arm.result);
        }
        return null;
    }

    @Override
    public Void visitArrayLiteral(Expr.ArrayLiteral expr) {
        for (ExprInterface e : expr.elements) {
            visit(e);
        }
        return null;
    }

    // -------------------------
    // Helpers
    // -------------------------

    private void checkArity(String name, List<FunctionParam> params, int actual, int line, int column) {
        int required = 0;
        for (FunctionParam p : params) {
            if (!p.isOptional()) required++;
        }
        int total = params.size();
        if (actual < required) {
            error(SemanticErrorKind.WRONG_ARGUMENT_COUNT, "Function '" + name + "' expects at least "
                    + required + " argument(s), but got " + actual, line, column);
        } else if (actual > total) {
            error(SemanticErrorKind.WRONG_ARGUMENT_COUNT, "Function '" + name + "' expects at most "
                    + total + " argument(s), but got " + actual, line, column);
        }
    }

    private void inScope(ScopeKind kind, Stmt body) {
        symbols.enterScope(kind);
        body.accept(this);
        symbols.exitScope();
    }

    private void warnIfShadowing(String name, int line, int column) {
        if (!reportShadowing) return;
        Scope current = symbols.currentScope();
        if (current.kind() == ScopeKind.GLOBAL) return;
        Symbol outer = symbols.lookup(name);
        if (outer != null && !outer.isBuiltin() && outer.kind() != SymbolKind.FUNCTION) {
            warnings.add(new SemanticWarning("Variable '" + name + "' shadows a declaration at line " + outer.line(),
                    line, column, contextLine(line)));
        }
    }

    private static boolean isInputCall(ExprInterface expr) {
        return expr instanceof Expr.Call && isInputName(((Expr.Call) expr).callee);
    }

    private static boolean isInputName(String callee) {
        return "input".equals(callee) || callee.startsWith("input.");
    }

    private void error(SemanticErrorKind kind, String message, int line, int column) {
        errors.add(new SemanticError(kind, message, line, column, contextLine(line)));
    }

    private String contextLine(int line) {
        if (sourceLines == null || line < 1 || line > sourceLines.length) return null;
        String text = sourceLines[line - 1];
        return text.endsWith("\r") ? text.substring(0, text.length() - 1) : text;
    }
}
