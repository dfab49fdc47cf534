package com.elara.pine.codegen;

import java.util.function.Predicate;

import com.elara.pine.parser.Expr;
import com.elara.pine.parser.Expr.ExprInterface;

/**
 * Pre-order traversal over an expression tree. The visitor predicate returns false to
 * stop descending into a node's children.
 */
final class ExprWalker implements Expr.ExprVisitor<Void> {
    private final Predicate<ExprInterface> visitor;

    private ExprWalker(Predicate<ExprInterface> visitor) {
        this.visitor = visitor;
    }

    static void walk(ExprInterface root, Predicate<ExprInterface> visitor) {
        if (root == null) return;
        new ExprWalker(visitor).visit(root);
    }

    /** True when any node under {@code root} satisfies {@code test}. */
    static boolean any(ExprInterface root, Predicate<ExprInterface> test) {
        boolean[] found = new boolean[1];
        walk(root, node -> {
            if (found[0]) return false;
            if (test.test(node)) {
                found[0] = true;
                return false;
            }
            return true;
        });
        return found[0];
    }

    private void visit(ExprInterface expr) {
        if (expr == null) return;
        if (visitor.test(expr)) {
            expr.accept(this);
        }
    }

    private void visitArgs(java.util.List<Expr.Argument> args) {
        for (Expr.Argument a : args) {
            visit(a.value);
        }
    }

    @Override public Void visitNumberLiteral(Expr.NumberLiteral expr) { return null; }
    @Override public Void visitStringLiteral(Expr.StringLiteral expr) { return null; }
    @Override public Void visitIdentifier(Expr.Identifier expr) { return null; }
    @Override public Void visitMember(Expr.Member expr) { return null; }

    @Override
    public Void visitFieldAccess(Expr.FieldAccess expr) {
        visit(expr.object);
        return null;
    }

    @Override
    public Void visitCall(Expr.Call expr) {
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
}
