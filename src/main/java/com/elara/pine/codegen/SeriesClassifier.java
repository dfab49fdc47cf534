package com.elara.pine.codegen;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.elara.pine.parser.Expr;
import com.elara.pine.parser.Expr.ExprInterface;

/**
 * Decides whether an expression yields a per-bar series or a single value. Every node
 * visited is recorded in the optional sink, so one call over a statement's root
 * classifies the whole tree.
 */
final class SeriesClassifier implements Expr.ExprVisitor<Classification> {
    private final Set<String> seriesNames;
    private final Map<String, String> variables;
    private final Set<String> functions;
    private final Set<String> aliases;
    private final Map<ExprInterface, Classification> sink;

    SeriesClassifier(Set<String> seriesNames, Map<String, String> variables, Set<String> functions,
                     Set<String> aliases, Map<ExprInterface, Classification> sink) {
        this.seriesNames = seriesNames;
        this.variables = variables;
        this.functions = functions;
        this.aliases = aliases;
        this.sink = sink;
    }

    Classification classify(ExprInterface expr) {
        if (expr == null) return Classification.SCALAR;
        Classification c = expr.accept(this);
        if (sink != null) sink.put(expr, c);
        return c;
    }

    private static Classification of(boolean series) {
        return series ? Classification.SERIES : Classification.SCALAR;
    }

    private void classifyArgs(List<Expr.Argument> args) {
        for (Expr.Argument a : args) {
            classify(a.value);
        }
    }

    static boolean isNa(ExprInterface expr) {
        return expr instanceof Expr.Identifier && "na".equals(((Expr.Identifier) expr).name);
    }

    @Override
    public Classification visitNumberLiteral(Expr.NumberLiteral expr) {
        return Classification.SCALAR;
    }

    @Override
    public Classification visitStringLiteral(Expr.StringLiteral expr) {
        return Classification.SCALAR;
    }

    @Override
    public Classification visitIdentifier(Expr.Identifier expr) {
        String mapped = variables.get(expr.name);
        String target = mapped != null ? mapped : Identifiers.sanitize(expr.name);
        return of(seriesNames.contains(target));
    }

    @Override
    public Classification visitMember(Expr.Member expr) {
        return Classification.SCALAR;
    }

    @Override
    public Classification visitFieldAccess(Expr.FieldAccess expr) {
        classify(expr.object);
        return Classification.SCALAR;
    }

    @Override
    public Classification visitCall(Expr.Call expr) {
        Classification first = Classification.SCALAR;
        for (int i = 0; i < expr.args.size(); i++) {
            Classification c = classify(expr.args.get(i).value);
            if (i == 0) first = c;
        }
        String callee = expr.callee;
        if (FunctionMapper.isTechnicalAnalysis(callee) || functions.contains(callee)) {
            return Classification.SERIES;
        }
        int dot = callee.indexOf('.');
        if (dot > 0 && aliases.contains(callee.substring(0, dot))) {
            return Classification.SERIES;
        }
        if ("nz".equals(callee) || "fixnan".equals(callee)) {
            return first;
        }
        return Classification.SCALAR;
    }

    @Override
    public Classification visitMethodCall(Expr.MethodCall expr) {
        classify(expr.receiver);
        classifyArgs(expr.args);
        return Classification.SCALAR;
    }

    @Override
    public Classification visitTypeInstantiation(Expr.TypeInstantiation expr) {
        classifyArgs(expr.args);
        return Classification.SCALAR;
    }

    @Override
    public Classification visitBinary(Expr.Binary expr) {
        Classification left = classify(expr.left);
        Classification right = classify(expr.right);
        return of(left == Classification.SERIES || right == Classification.SERIES);
    }

    @Override
    public Classification visitUnary(Expr.Unary expr) {
        return classify(expr.operand);
    }

    @Override
    public Classification visitTernary(Expr.Ternary expr) {
        classify(expr.condition);
        Classification consequent = classify(expr.thenBranch);
        Classification alternate = classify(expr.elseBranch);
        if (consequent == Classification.SERIES || alternate == Classification.SERIES) {
            return Classification.SERIES;
        }
        // na next to a call still produces a series: na(x) ? na : f(x)
        boolean naWithCall = (isNa(expr.thenBranch) && expr.elseBranch instanceof Expr.Call)
                || (isNa(expr.elseBranch) && expr.thenBranch instanceof Expr.Call);
        return of(naWithCall);
    }

    @Override
    public Classification visitHistoryAccess(Expr.HistoryAccess expr) {
        Classification base = classify(expr.base);
        classify(expr.offset);
        return base;
    }

    @Override
    public Classification visitSwitch(Expr.Switch expr) {
        classify(expr.subject);
        boolean series = false;
        for (Expr.SwitchArm arm : expr.arms) {
            classify(arm.match);
            if (classify(arm.result) == Classification.SERIES) series = true;
        }
        return of(series);
    }

    @Override
    public Classification visitArrayLiteral(Expr.ArrayLiteral expr) {
        for (ExprInterface e : expr.elements) {
            classify(e);
        }
        return Classification.SCALAR;
    }
}
