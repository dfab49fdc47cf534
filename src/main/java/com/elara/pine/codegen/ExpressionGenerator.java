package com.elara.pine.codegen;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.elara.pine.parser.Expr;
import com.elara.pine.parser.Expr.ExprInterface;

/**
 * Renders expressions as target text. Operators between series become method calls on
 * the series; operators between plain values stay infix.
 */
public class ExpressionGenerator implements Expr.ExprVisitor<String> {

    private static final Map<String, String> SERIES_METHODS = new HashMap<>();

    static {
        SERIES_METHODS.put("+", "add");
        SERIES_METHODS.put("-", "sub");
        SERIES_METHODS.put("*", "mul");
        SERIES_METHODS.put("/", "div");
        SERIES_METHODS.put("%", "mod");
        SERIES_METHODS.put(">", "gt");
        SERIES_METHODS.put("<", "lt");
        SERIES_METHODS.put(">=", "gte");
        SERIES_METHODS.put("<=", "lte");
        SERIES_METHODS.put("==", "eq");
        SERIES_METHODS.put("!=", "neq");
        SERIES_METHODS.put("&&", "and");
        SERIES_METHODS.put("||", "or");
    }

    /** Display calls with no counterpart in the generated output. */
    static final Set<String> UNSUPPORTED_DISPLAY = new HashSet<>(Arrays.asList(
            "hline", "bgcolor", "barcolor", "plotshape", "plotchar", "plotarrow", "plotcandle", "plotbar",
            "alertcondition"));

    private static final Set<String> DISPLAY_MODES = new HashSet<>(Arrays.asList(
            "all", "none", "data_window", "status_line", "pane"));

    private final GeneratorContext ctx;
    private final EmissionState state;
    private final CodeWriter writer;
    private String receiverType;

    public ExpressionGenerator(GeneratorContext ctx, EmissionState state, CodeWriter writer) {
        this.ctx = ctx;
        this.state = state;
        this.writer = writer;
    }

    /** Type bound to {@code this}/{@code self} while a method body is emitted; null outside methods. */
    void setReceiverType(String typeName) {
        this.receiverType = typeName;
    }

    public String generate(ExprInterface expr) {
        if (expr == null) return "";
        return expr.accept(this);
    }

    private String arguments(List<Expr.Argument> args) {
        List<String> out = new ArrayList<>();
        for (Expr.Argument a : args) {
            out.add(generate(a.value));
        }
        return String.join(", ", out);
    }

    static String constantSeries(String value) {
        return "new Series(bars, () => " + value + ")";
    }

    // -------------------------
    // Literals and names
    // -------------------------

    @Override
    public String visitNumberLiteral(Expr.NumberLiteral expr) {
        return Identifiers.formatNumber(expr.value);
    }

    @Override
    public String visitStringLiteral(Expr.StringLiteral expr) {
        return Identifiers.quote(expr.value);
    }

    @Override
    public String visitIdentifier(Expr.Identifier expr) {
        return IdentifierMapper.translate(expr.name, ctx.variables());
    }

    @Override
    public String visitMember(Expr.Member expr) {
        return IdentifierMapper.translateMember(expr.path);
    }

    @Override
    public String visitFieldAccess(Expr.FieldAccess expr) {
        return generate(expr.object) + "." + expr.field;
    }

    // -------------------------
    // Operators
    // -------------------------

    @Override
    public String visitBinary(Expr.Binary expr) {
        String left = generate(expr.left);
        String right = generate(expr.right);
        String method = SERIES_METHODS.get(expr.operator);
        if (method != null) {
            boolean leftSeries = ctx.isSeries(expr.left);
            boolean rightSeries = ctx.isSeries(expr.right);
            if (leftSeries) {
                return left + "." + method + "(" + right + ")";
            }
            if (rightSeries) {
                if ("+".equals(expr.operator) || "*".equals(expr.operator)) {
                    return right + "." + method + "(" + left + ")";
                }
                return constantSeries(left) + "." + method + "(" + right + ")";
            }
        }
        return "(" + left + " " + expr.operator + " " + right + ")";
    }

    @Override
    public String visitUnary(Expr.Unary expr) {
        String operand = generate(expr.operand);
        if (ctx.isSeries(expr.operand)) {
            if ("-".equals(expr.operator)) return operand + ".neg()";
            if ("!".equals(expr.operator)) return operand + ".not()";
        }
        if ("+".equals(expr.operator)) return operand;
        return expr.operator + operand;
    }

    @Override
    public String visitTernary(Expr.Ternary expr) {
        String condition = generate(expr.condition);
        String consequent = generate(expr.thenBranch);
        String alternate = generate(expr.elseBranch);

        boolean consNa = SeriesClassifier.isNa(expr.thenBranch);
        boolean altNa = SeriesClassifier.isNa(expr.elseBranch);
        if (ctx.isSeries(expr.thenBranch) && (altNa || expr.elseBranch instanceof Expr.NumberLiteral)) {
            alternate = constantSeries(alternate);
        } else if (ctx.isSeries(expr.elseBranch) && (consNa || expr.thenBranch instanceof Expr.NumberLiteral)) {
            consequent = constantSeries(consequent);
        } else if (altNa && !consNa) {
            alternate = constantSeries(alternate);
        } else if (consNa && !altNa) {
            consequent = constantSeries(consequent);
        }
        return "(" + condition + " ? " + consequent + " : " + alternate + ")";
    }

    @Override
    public String visitHistoryAccess(Expr.HistoryAccess expr) {
        return generate(expr.base) + ".offset(" + generate(expr.offset) + ")";
    }

    // -------------------------
    // Compound values
    // -------------------------

    @Override
    public String visitSwitch(Expr.Switch expr) {
        List<String> lines = new ArrayList<>();
        lines.add("(() => {");
        if (expr.subject != null) {
            lines.add("  switch (" + generate(expr.subject) + ") {");
            boolean hasDefault = false;
            for (Expr.SwitchArm arm : expr.arms) {
                String result = generate(arm.result);
                if (arm.isDefault()) {
                    hasDefault = true;
                    lines.add("    default: return " + result + ";");
                } else {
                    lines.add("    case " + generate(arm.match) + ": return " + result + ";");
                }
            }
            if (!hasDefault) lines.add("    default: return NaN;");
            lines.add("  }");
        } else {
            boolean first = true;
            boolean hasDefault = false;
            for (Expr.SwitchArm arm : expr.arms) {
                String result = generate(arm.result);
                if (arm.isDefault()) {
                    hasDefault = true;
                    lines.add(first ? "  return " + result + ";" : "  else return " + result + ";");
                } else {
                    String keyword = first ? "if" : "else if";
                    lines.add("  " + keyword + " (" + generate(arm.match) + ") return " + result + ";");
                }
                first = false;
            }
            if (!hasDefault) lines.add(first ? "  return NaN;" : "  else return NaN;");
        }
        lines.add("})()");

        StringBuilder pad = new StringBuilder();
        for (int i = 0; i < writer.level(); i++) pad.append(CodeWriter.INDENT);
        return String.join("\n" + pad, lines);
    }

    @Override
    public String visitArrayLiteral(Expr.ArrayLiteral expr) {
        List<String> out = new ArrayList<>();
        for (ExprInterface e : expr.elements) {
            out.add(generate(e));
        }
        return "[" + String.join(", ", out) + "]";
    }

    @Override
    public String visitTypeInstantiation(Expr.TypeInstantiation expr) {
        return expr.typeName + ".new(" + arguments(expr.args) + ")";
    }

    @Override
    public String visitMethodCall(Expr.MethodCall expr) {
        String receiver = generate(expr.receiver);
        String args = arguments(expr.args);
        String type = typeOf(expr.receiver);
        if (type != null && ctx.hasMethod(type, expr.method)) {
            return type + "." + expr.method + "(" + receiver + (args.isEmpty() ? "" : ", " + args) + ")";
        }
        return receiver + "." + expr.method + "(" + args + ")";
    }

    private String typeOf(ExprInterface receiver) {
        if (!(receiver instanceof Expr.Identifier)) return null;
        String name = ((Expr.Identifier) receiver).name;
        if (receiverType != null && ("this".equals(name) || "self".equals(name))) return receiverType;
        return ctx.declaredTypeOf(name);
    }

    // -------------------------
    // Calls
    // -------------------------

    @Override
    public String visitCall(Expr.Call expr) {
        String name = expr.callee;

        if ("array.new".equals(name)) {
            ExprInterface size = expr.positional(0);
            ExprInterface fill = expr.positional(1);
            if (size == null) return "[]";
            return "new Array(" + generate(size) + ").fill(" + (fill == null ? "null" : generate(fill)) + ")";
        }
        if ("plot".equals(name)) {
            registerPlot(expr);
            return "";
        }
        if ("fill".equals(name)) {
            registerFill(expr);
            return "";
        }
        if (UNSUPPORTED_DISPLAY.contains(name)) {
            state.warn("Unsupported display function '" + name + "()' was skipped", expr.line(), expr.column());
            return "";
        }
        if (InputType.isInputCall(name)) {
            return "";
        }

        String args = arguments(expr.args);
        if ("ta.vwma".equals(name)) {
            state.imports().trackNamespace(name);
            return "ta.vwma(" + args + ", volume)";
        }
        if ("runtime.error".equals(name)) {
            return "(() => { throw new Error(" + args + "); })()";
        }
        if ("nz".equals(name) || "na".equals(name)) {
            state.imports().trackFunction(name);
            return name + "(" + args + ")";
        }

        String translated = FunctionMapper.translate(name);
        state.imports().trackNamespace(translated);
        return translated + "(" + args + ")";
    }

    private String stringValue(ExprInterface expr) {
        if (expr instanceof Expr.StringLiteral) return ((Expr.StringLiteral) expr).value;
        if (expr instanceof Expr.Identifier) return ((Expr.Identifier) expr).name;
        return generate(expr);
    }

    private static boolean isDisplay(ExprInterface expr, String mode) {
        return expr instanceof Expr.Member && ("display." + mode).equals(((Expr.Member) expr).path);
    }

    /** Condition of {@code cond ? display.all : display.none}, or null for any other shape. */
    private String displayCondition(ExprInterface display) {
        if (display instanceof Expr.Ternary) {
            Expr.Ternary t = (Expr.Ternary) display;
            if (isDisplay(t.thenBranch, "all") && isDisplay(t.elseBranch, "none")) {
                return generate(t.condition);
            }
        }
        return null;
    }

    private void registerPlot(Expr.Call call) {
        ExprInterface source = call.positional(0);
        if (source == null) return;
        String sourceText = generate(source);
        int index = state.nextPlotIndex();
        String id = "plot" + index;

        ExprInterface titleArg = call.named("title");
        if (titleArg == null && call.positional(1) instanceof Expr.StringLiteral) {
            titleArg = call.positional(1);
        }
        String title = Identifiers.unquote(titleArg != null ? stringValue(titleArg) : sourceText);
        if (title.contains(".") || title.contains("(")) {
            title = "Plot " + index;
        }

        ExprInterface colorArg = call.named("color");
        String color = colorArg != null
                ? ColorMapper.colorOf(colorArg, ColorMapper.DEFAULT_PLOT_COLOR)
                : ColorMapper.DEFAULT_PLOT_COLOR;

        double lineWidth = 2;
        Double width = InfoCollector.numericValue(call.named("linewidth"));
        if (width != null && width != 0) lineWidth = width;

        String display = null;
        String visible = null;
        ExprInterface displayArg = call.named("display");
        if (displayArg != null) {
            visible = displayCondition(displayArg);
            if (visible != null) {
                display = "all";
            } else if (displayArg instanceof Expr.Member && ((Expr.Member) displayArg).path.startsWith("display.")) {
                String mode = ((Expr.Member) displayArg).path.substring("display.".length());
                if (DISPLAY_MODES.contains(mode)) display = mode;
            } else if (displayArg instanceof Expr.Ternary) {
                visible = generate(displayArg).replace("display.all", "true").replace("display.none", "false");
                display = "all";
            }
        }

        double offset = 0;
        Double off = InfoCollector.numericValue(call.named("offset"));
        if (off != null) offset = off;

        String series = ctx.isSeries(source) ? sourceText : constantSeries(sourceText);
        state.addPlot(new PlotConfig(id, title, color, lineWidth, display, visible, offset),
                series + ".toArray().map((v: number | undefined, i: number) => ({ time: bars[i]!.time, value: v ?? NaN }))");
    }

    private void registerFill(Expr.Call call) {
        ExprInterface first = call.positional(0);
        ExprInterface second = call.positional(1);
        if (first == null || second == null) return;

        String plot1 = plotReference(first);
        String plot2 = plotReference(second);

        String color = ColorMapper.DEFAULT_FILL_COLOR;
        String visible = null;
        ExprInterface colorArg = call.named("color");
        if (colorArg instanceof Expr.Ternary && SeriesClassifier.isNa(((Expr.Ternary) colorArg).elseBranch)) {
            Expr.Ternary t = (Expr.Ternary) colorArg;
            visible = generate(t.condition);
            color = ColorMapper.colorOf(t.thenBranch, ColorMapper.DEFAULT_FILL_COLOR);
        } else if (colorArg != null) {
            color = ColorMapper.colorOf(colorArg, ColorMapper.DEFAULT_FILL_COLOR);
        }

        ExprInterface displayArg = call.named("display");
        if (displayArg != null && visible == null) {
            visible = displayCondition(displayArg);
        }

        ExprInterface titleArg = call.named("title");
        String title = titleArg != null ? Identifiers.unquote(stringValue(titleArg)) : null;

        String id = "fill" + state.nextFillIndex();
        state.addFill(new FillConfig(id, plot1, plot2, color, title, visible));
    }

    private String plotReference(ExprInterface expr) {
        String name = expr instanceof Expr.Identifier ? ((Expr.Identifier) expr).name : "";
        String id = state.plotIdOf(Identifiers.sanitize(name));
        return id != null ? id : name;
    }

    // -------------------------
    // Recurrences
    // -------------------------

    /**
     * Renders the right-hand side of a self-referencing reassignment as a per-bar scalar
     * formula: {@code x[1]} reads {@code prev}, other series read their value at bar {@code i}.
     */
    public String recurrence(ExprInterface expr, String variable, String prev) {
        if (expr instanceof Expr.HistoryAccess) {
            Expr.HistoryAccess h = (Expr.HistoryAccess) expr;
            if (h.base instanceof Expr.Identifier && variable.equals(((Expr.Identifier) h.base).name)) {
                return prev;
            }
            if (ctx.isSeries(h.base)) {
                return generate(h.base) + ".get(i - " + recurrence(h.offset, variable, prev) + ")";
            }
            return generate(expr);
        }
        if (expr instanceof Expr.Ternary) {
            Expr.Ternary t = (Expr.Ternary) expr;
            return "(" + recurrence(t.condition, variable, prev) + " ? " + recurrence(t.thenBranch, variable, prev)
                    + " : " + recurrence(t.elseBranch, variable, prev) + ")";
        }
        if (expr instanceof Expr.Binary) {
            Expr.Binary b = (Expr.Binary) expr;
            return "(" + recurrence(b.left, variable, prev) + " " + b.operator + " "
                    + recurrence(b.right, variable, prev) + ")";
        }
        if (expr instanceof Expr.Unary) {
            Expr.Unary u = (Expr.Unary) expr;
            String operand = recurrence(u.operand, variable, prev);
            return "+".equals(u.operator) ? operand : u.operator + operand;
        }
        if (expr instanceof Expr.Call) {
            Expr.Call call = (Expr.Call) expr;
            String translated = FunctionMapper.translate(call.callee);
            if (translated.startsWith("ta.")) {
                // whole-series functions are evaluated once and indexed per bar
                return generate(call) + ".get(i)";
            }
            List<String> args = new ArrayList<>();
            for (Expr.Argument a : call.args) {
                args.add(recurrence(a.value, variable, prev));
            }
            if ("na".equals(call.callee) || "nz".equals(call.callee)) {
                state.imports().trackFunction(call.callee);
            } else {
                state.imports().trackNamespace(translated);
            }
            return translated + "(" + String.join(", ", args) + ")";
        }
        if (expr instanceof Expr.Identifier) {
            String name = ((Expr.Identifier) expr).name;
            String translated = IdentifierMapper.translate(name, ctx.variables());
            if (!name.equals(variable) && ctx.isSeriesName(translated)) {
                return translated + ".get(i)";
            }
            return translated;
        }
        return generate(expr);
    }
}
