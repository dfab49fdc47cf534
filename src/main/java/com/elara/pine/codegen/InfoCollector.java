package com.elara.pine.codegen;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.elara.debug.Debug;
import com.elara.pine.parser.Expr;
import com.elara.pine.parser.Expr.ExprInterface;
import com.elara.pine.parser.Statement;
import com.elara.pine.parser.Statement.Stmt;

/**
 * First generation pass. Walks the whole program once and records everything the
 * emitters must know before the first line is written: header metadata, inputs,
 * user types, imports, which names hold series, which reassignments are recurrences,
 * and which optional preamble blocks are needed.
 */
public class InfoCollector implements Statement.StmtVisitor {

    private static final String TAG = "InfoCollector";

    /** Price sources available as series in every indicator body. */
    public static final List<String> PRICE_SOURCES = Collections.unmodifiableList(Arrays.asList(
            "open", "high", "low", "close", "volume", "hl2", "hlc3", "ohlc4", "hlcc4"));

    /** Calendar series the preamble can provide. */
    public static final List<String> TIME_SERIES = Collections.unmodifiableList(Arrays.asList(
            "year", "month", "dayofmonth", "dayofweek", "hour", "minute"));

    private static final Set<String> BUILTIN_TYPES = new HashSet<>(Arrays.asList(
            "int", "float", "bool", "string", "color", "line", "label", "box", "table"));

    private final GeneratorContext.Builder builder = GeneratorContext.builder();

    private final List<InputDefinition> inputs = new ArrayList<>();
    private final Map<String, String> variables = new LinkedHashMap<>();
    private final Set<String> seriesNames = new LinkedHashSet<>();
    private final Set<String> reassigned = new LinkedHashSet<>();
    private final Set<String> recursive = new LinkedHashSet<>();
    private final Set<String> functions = new LinkedHashSet<>();
    private final Set<String> aliases = new LinkedHashSet<>();
    private final Set<String> typeNames = new LinkedHashSet<>();
    private final Map<String, String> declaredTypes = new LinkedHashMap<>();

    private final List<Statement.Declaration> declarations = new ArrayList<>();
    private final List<Statement.TupleDestructuring> tuples = new ArrayList<>();
    private final List<Statement.Reassignment> reassignments = new ArrayList<>();
    private final List<ExprInterface> roots = new ArrayList<>();

    private boolean usesSyminfo;
    private boolean usesTimeframe;
    private boolean usesBarIndex;
    private final Set<String> timeSeries = new LinkedHashSet<>();

    private boolean collected;

    /** Collects facts for one program. An instance is single-use. */
    public GeneratorContext collect(List<Stmt> statements) {
        if (collected) {
            throw new IllegalStateException("InfoCollector instances are single-use");
        }
        collected = true;

        seriesNames.addAll(PRICE_SOURCES);
        for (Stmt s : statements) {
            s.accept(this);
        }
        for (String t : TIME_SERIES) {
            if (timeSeries.contains(t)) seriesNames.add(t);
        }
        seriesNames.addAll(recursive);
        propagateSeries();

        Map<ExprInterface, Classification> classes = new IdentityHashMap<>();
        SeriesClassifier classifier = new SeriesClassifier(seriesNames, variables, functions, aliases, classes);
        for (ExprInterface root : roots) {
            classifier.classify(root);
        }

        for (InputDefinition in : inputs) builder.addInput(in);
        for (Map.Entry<String, String> e : variables.entrySet()) builder.mapVariable(e.getKey(), e.getValue());
        for (String s : seriesNames) builder.addSeries(s);
        for (String s : reassigned) builder.addReassigned(s);
        for (String s : recursive) builder.addRecursive(s);
        for (String s : functions) builder.addFunction(s);
        for (Map.Entry<String, String> e : declaredTypes.entrySet()) {
            if (typeNames.contains(e.getValue())) builder.declaredType(e.getKey(), e.getValue());
        }
        for (String t : timeSeries) builder.addTimeSeries(t);
        for (Map.Entry<ExprInterface, Classification> e : classes.entrySet()) builder.classify(e.getKey(), e.getValue());
        builder.usesSyminfo(usesSyminfo).usesTimeframe(usesTimeframe).usesBarIndex(usesBarIndex);

        Debug.get().d(TAG, "inputs=" + inputs.size() + " series=" + seriesNames.size()
                + " reassigned=" + reassigned.size() + " recursive=" + recursive.size()
                + " classified=" + classes.size());
        return builder.build();
    }

    /** Adds names bound or rebound to series-producing values until nothing changes. */
    private void propagateSeries() {
        SeriesClassifier probe = new SeriesClassifier(seriesNames, variables, functions, aliases, null);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Statement.Declaration d : declarations) {
                String target = targetName(d.name);
                if (seriesNames.contains(target)) continue;
                boolean series = (reassigned.contains(d.name) && d.initializer instanceof Expr.NumberLiteral)
                        || probe.classify(d.initializer) == Classification.SERIES;
                if (series) {
                    seriesNames.add(target);
                    changed = true;
                }
            }
            for (Statement.Reassignment r : reassignments) {
                String name = r.targetName();
                if (name == null) continue;
                String target = targetName(name);
                if (seriesNames.contains(target)) continue;
                if (probe.classify(r.value) == Classification.SERIES) {
                    seriesNames.add(target);
                    changed = true;
                }
            }
            for (Statement.TupleDestructuring t : tuples) {
                if (probe.classify(t.initializer) != Classification.SERIES) continue;
                for (String name : t.names) {
                    if (seriesNames.add(targetName(name))) changed = true;
                }
            }
        }
    }

    private String targetName(String name) {
        String mapped = variables.get(name);
        return mapped != null ? mapped : Identifiers.sanitize(name);
    }

    // -------------------------
    // Expression scanning
    // -------------------------

    private void scan(ExprInterface expr) {
        if (expr == null) return;
        roots.add(expr);
        ExprWalker.walk(expr, node -> {
            if (node instanceof Expr.Identifier) {
                String name = ((Expr.Identifier) node).name;
                if (TIME_SERIES.contains(name)) timeSeries.add(name);
                if ("bar_index".equals(name) || "last_bar_index".equals(name)) usesBarIndex = true;
            } else if (node instanceof Expr.Member) {
                String root = ((Expr.Member) node).root();
                if ("syminfo".equals(root)) usesSyminfo = true;
                if ("timeframe".equals(root)) usesTimeframe = true;
            }
            return true;
        });
    }

    private void walkBlock(Statement.Block block) {
        if (block == null) return;
        for (Stmt s : block.statements) {
            s.accept(this);
        }
    }

    static boolean containsHistoryAccessTo(ExprInterface expr, String name) {
        return ExprWalker.any(expr, node -> {
            if (!(node instanceof Expr.HistoryAccess)) return false;
            ExprInterface base = ((Expr.HistoryAccess) node).base;
            return base instanceof Expr.Identifier && name.equals(((Expr.Identifier) base).name);
        });
    }

    // -------------------------
    // Headers
    // -------------------------

    @Override
    public void visitIndicatorDeclaration(Statement.IndicatorDeclaration stmt) {
        String title = null;
        String shortTitle = null;
        boolean overlay = false;
        if (!stmt.args.isEmpty() && !stmt.args.get(0).isNamed()
                && stmt.args.get(0).value instanceof Expr.StringLiteral) {
            title = ((Expr.StringLiteral) stmt.args.get(0).value).value;
        }
        for (Expr.Argument a : stmt.args) {
            if (!a.isNamed()) continue;
            switch (a.name) {
                case "title":
                    if (a.value instanceof Expr.StringLiteral) title = ((Expr.StringLiteral) a.value).value;
                    break;
                case "shorttitle":
                    if (a.value instanceof Expr.StringLiteral) shortTitle = ((Expr.StringLiteral) a.value).value;
                    break;
                case "overlay":
                    overlay = isTrue(a.value);
                    break;
                default:
                    break;
            }
        }
        if (title == null || title.isEmpty()) title = "Indicator";
        if (shortTitle == null || shortTitle.isEmpty()) shortTitle = title;
        builder.title(title).shortTitle(shortTitle).overlay(overlay);
    }

    @Override
    public void visitLibraryDeclaration(Statement.LibraryDeclaration stmt) {
        String name = "Library";
        boolean overlay = false;
        for (Expr.Argument a : stmt.args) {
            if (!a.isNamed() && a == stmt.args.get(0) && a.value instanceof Expr.StringLiteral) {
                name = ((Expr.StringLiteral) a.value).value;
            } else if ("title".equals(a.name) && a.value instanceof Expr.StringLiteral) {
                name = ((Expr.StringLiteral) a.value).value;
            } else if ("overlay".equals(a.name)) {
                overlay = isTrue(a.value);
            }
        }
        builder.library(new LibraryInfo(name, overlay)).title(name).shortTitle(name).overlay(overlay);
    }

    private static boolean isTrue(ExprInterface value) {
        return value instanceof Expr.Identifier && "true".equals(((Expr.Identifier) value).name);
    }

    @Override
    public void visitImport(Statement.ImportStatement stmt) {
        builder.addImport(new ImportInfo(stmt.publisher, stmt.library, stmt.version, stmt.alias));
        aliases.add(stmt.alias);
    }

    @Override
    public void visitTypeDeclaration(Statement.TypeDeclaration stmt) {
        List<TypeInfo.FieldInfo> fields = new ArrayList<>();
        for (Statement.Field f : stmt.fields) {
            fields.add(new TypeInfo.FieldInfo(f.name, f.typeName, f.defaultValue));
            scan(f.defaultValue);
        }
        builder.addType(new TypeInfo(stmt.name, fields, stmt.exported));
        typeNames.add(stmt.name);
    }

    @Override
    public void visitMethodDeclaration(Statement.MethodDeclaration stmt) {
        builder.addMethod(new MethodInfo(stmt));
        for (Statement.Parameter p : stmt.params) {
            scan(p.defaultValue);
        }
        walkBlock(stmt.body);
    }

    @Override
    public void visitFunctionDeclaration(Statement.FunctionDeclaration stmt) {
        functions.add(stmt.name);
        for (Statement.Parameter p : stmt.params) {
            scan(p.defaultValue);
        }
        walkBlock(stmt.body);
    }

    // -------------------------
    // Bindings
    // -------------------------

    @Override
    public void visitDeclaration(Statement.Declaration stmt) {
        ExprInterface init = stmt.initializer;
        if (init instanceof Expr.Call && InputType.isInputCall(((Expr.Call) init).callee)) {
            collectInput(stmt.name, (Expr.Call) init);
            return;
        }
        if (init instanceof Expr.TypeInstantiation) {
            declaredTypes.put(stmt.name, ((Expr.TypeInstantiation) init).typeName);
        } else if (stmt.typeName != null && !BUILTIN_TYPES.contains(stmt.typeName)) {
            declaredTypes.put(stmt.name, stmt.typeName);
        }
        declarations.add(stmt);
        scan(init);
    }

    @Override
    public void visitReassignment(Statement.Reassignment stmt) {
        String name = stmt.targetName();
        if (name != null) {
            reassigned.add(name);
            reassignments.add(stmt);
            if (containsHistoryAccessTo(stmt.value, name)) {
                recursive.add(name);
            }
        }
        scan(stmt.target);
        scan(stmt.value);
    }

    @Override
    public void visitTupleDestructuring(Statement.TupleDestructuring stmt) {
        tuples.add(stmt);
        scan(stmt.initializer);
    }

    private void collectInput(String name, Expr.Call call) {
        for (InputDefinition existing : inputs) {
            if (existing.name().equals(name)) return;
        }
        InputType type = InputType.forCall(call.callee);
        boolean generic = type == null && "input".equals(call.callee);
        if (type == null) type = generic ? InputType.SOURCE : InputType.STRING;

        ExprInterface defaultExpr = call.named("defval");
        if (defaultExpr == null) defaultExpr = call.positional(0);

        if (generic) {
            Double number = numericValue(defaultExpr);
            if (number != null) {
                type = number == Math.rint(number) ? InputType.INT : InputType.FLOAT;
            } else if (isTrue(defaultExpr) || isFalse(defaultExpr)) {
                type = InputType.BOOL;
            }
        }
        String defaultValue = literalText(defaultExpr, type);

        String title = null;
        ExprInterface titleExpr = call.named("title");
        if (titleExpr == null) titleExpr = call.positional(1);
        if (titleExpr instanceof Expr.StringLiteral) title = ((Expr.StringLiteral) titleExpr).value;

        List<String> options = null;
        ExprInterface optionsExpr = call.named("options");
        if (optionsExpr instanceof Expr.ArrayLiteral) {
            options = new ArrayList<>();
            for (ExprInterface e : ((Expr.ArrayLiteral) optionsExpr).elements) {
                if (e instanceof Expr.StringLiteral) options.add(((Expr.StringLiteral) e).value);
            }
        }

        inputs.add(new InputDefinition(name, type, defaultValue, title,
                numericValue(call.named("minval")), numericValue(call.named("maxval")),
                numericValue(call.named("step")), options));

        if (type == InputType.SOURCE) {
            String series = Identifiers.sanitize(name) + "Series";
            variables.put(name, series);
            seriesNames.add(series);
        } else {
            variables.put(name, name);
        }
        Debug.get().t(TAG, "input " + name + " type=" + type.label() + " default=" + defaultValue);
    }

    private static boolean isFalse(ExprInterface value) {
        return value instanceof Expr.Identifier && "false".equals(((Expr.Identifier) value).name);
    }

    /** Value of a numeric literal or a negated numeric literal, otherwise null. */
    static Double numericValue(ExprInterface expr) {
        if (expr instanceof Expr.NumberLiteral) {
            return ((Expr.NumberLiteral) expr).value;
        }
        if (expr instanceof Expr.Unary && "-".equals(((Expr.Unary) expr).operator)
                && ((Expr.Unary) expr).operand instanceof Expr.NumberLiteral) {
            return -((Expr.NumberLiteral) ((Expr.Unary) expr).operand).value;
        }
        return null;
    }

    private static String literalText(ExprInterface expr, InputType type) {
        Double number = numericValue(expr);
        if (number != null) return Identifiers.formatNumber(number);
        if (expr instanceof Expr.StringLiteral) return ((Expr.StringLiteral) expr).value;
        if (expr instanceof Expr.Identifier) return ((Expr.Identifier) expr).name;
        if (expr instanceof Expr.Member) return ((Expr.Member) expr).path;
        return type.fallbackDefault();
    }

    // -------------------------
    // Control flow: only descend
    // -------------------------

    @Override
    public void visitExprStmt(Statement.ExprStmt stmt) {
        scan(stmt.expression);
    }

    @Override
    public void visitBlock(Statement.Block stmt) {
        walkBlock(stmt);
    }

    @Override
    public void visitIf(Statement.If stmt) {
        scan(stmt.condition);
        walkBlock(stmt.thenBranch);
        if (stmt.elseBranch != null) stmt.elseBranch.accept(this);
    }

    @Override
    public void visitForRange(Statement.ForRange stmt) {
        scan(stmt.start);
        scan(stmt.end);
        scan(stmt.step);
        walkBlock(stmt.body);
    }

    @Override
    public void visitForIn(Statement.ForIn stmt) {
        scan(stmt.iterable);
        walkBlock(stmt.body);
    }

    @Override
    public void visitWhile(Statement.While stmt) {
        scan(stmt.condition);
        walkBlock(stmt.body);
    }

    @Override public void visitBreak(Statement.Break stmt) {}
    @Override public void visitContinue(Statement.Continue stmt) {}
    @Override public void visitComment(Statement.Comment stmt) {}
}
