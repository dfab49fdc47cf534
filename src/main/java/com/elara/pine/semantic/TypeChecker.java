package com.elara.pine.semantic;

import com.elara.pine.parser.Expr;
import com.elara.pine.parser.Expr.ExprInterface;

/**
 * Infers the static type of an expression against the current state of a symbol table.
 * Inference never fails; anything it cannot see through is UNKNOWN.
 */
public class TypeChecker implements Expr.ExprVisitor<PineType> {
    private final SymbolTable symbols;

    public TypeChecker(SymbolTable symbols) {
        this.symbols = symbols;
    }

    public PineType inferType(ExprInterface expr) {
        if (expr == null) return PineType.UNKNOWN;
        return expr.accept(this);
    }

    public boolean isAssignable(PineType source, PineType target) {
        return source.isAssignableTo(target);
    }

    @Override
    public PineType visitNumberLiteral(Expr.NumberLiteral expr) {
        return expr.isIntegral() ? PineType.INT : PineType.FLOAT;
    }

    @Override
    public PineType visitStringLiteral(Expr.StringLiteral expr) {
        return PineType.STRING;
    }

    @Override
    public PineType visitIdentifier(Expr.Identifier expr) {
        if ("na".equals(expr.name)) return PineType.NA;
        Symbol symbol = symbols.lookup(expr.name);
        return symbol != null ? symbol.type() : PineType.UNKNOWN;
    }

    @Override
    public PineType visitMember(Expr.Member expr) {
        Symbol symbol = symbols.lookup(expr.path);
        return symbol != null ? symbol.type() : PineType.UNKNOWN;
    }

    @Override
    public PineType visitFieldAccess(Expr.FieldAccess expr) {
        return PineType.UNKNOWN;
    }

    @Override
    public PineType visitCall(Expr.Call expr) {
        Symbol symbol = symbols.lookup(expr.callee);
        if (symbol != null && symbol.type().kind() == PineType.Kind.FUNCTION) {
            return symbol.type().returnType();
        }
        // unknown and user functions are assumed to produce a float series
        return PineType.series(PineType.FLOAT);
    }

    @Override
    public PineType visitMethodCall(Expr.MethodCall expr) {
        return PineType.UNKNOWN;
    }

    @Override
    public PineType visitTypeInstantiation(Expr.TypeInstantiation expr) {
        return PineType.userDefined(expr.typeName);
    }

    @Override
    public PineType visitBinary(Expr.Binary expr) {
        PineType left = inferType(expr.left);
        PineType right = inferType(expr.right);
        boolean series = left.isSeries() || right.isSeries();

        switch (expr.operator) {
            case ">": case "<": case ">=": case "<=": case "==": case "!=":
            case "&&": case "||":
                return series ? PineType.series(PineType.BOOL) : PineType.BOOL;
            default:
                break;
        }

        boolean isFloat = left.scalar().kind() == PineType.Kind.FLOAT || right.scalar().kind() == PineType.Kind.FLOAT;
        if (series) {
            return PineType.series(isFloat ? PineType.FLOAT : PineType.INT);
        }
        return isFloat ? PineType.FLOAT : PineType.INT;
    }

    @Override
    public PineType visitUnary(Expr.Unary expr) {
        PineType operand = inferType(expr.operand);
        if ("!".equals(expr.operator)) {
            return operand.isSeries() ? PineType.series(PineType.BOOL) : PineType.BOOL;
        }
        return operand;
    }

    @Override
    public PineType visitTernary(Expr.Ternary expr) {
        PineType consequent = inferType(expr.thenBranch);
        PineType alternate = inferType(expr.elseBranch);
        if (!consequent.isSeries() && !alternate.isSeries()) {
            return consequent;
        }
        PineType cons = consequent.scalar();
        PineType alt = alternate.scalar();
        if (cons.kind() == PineType.Kind.FLOAT || alt.kind() == PineType.Kind.FLOAT) {
            return PineType.series(PineType.FLOAT);
        }
        if (cons.kind() == PineType.Kind.NA) return PineType.series(alt);
        return PineType.series(cons);
    }

    @Override
    public PineType visitHistoryAccess(Expr.HistoryAccess expr) {
        PineType base = inferType(expr.base);
        return base.isSeries() ? base.elementType() : PineType.UNKNOWN;
    }

    @Override
    public PineType visitSwitch(Expr.Switch expr) {
        for (Expr.SwitchArm arm : expr.arms) {
            PineType t = inferType(arm.result);
            if (t.kind() != PineType.Kind.NA && t.kind() != PineType.Kind.UNKNOWN) return t;
        }
        return PineType.UNKNOWN;
    }

    @Override
    public PineType visitArrayLiteral(Expr.ArrayLiteral expr) {
        PineType element = expr.elements.isEmpty() ? PineType.UNKNOWN : inferType(expr.elements.get(0));
        return PineType.array(element);
    }
}
