package com.elara.pine.parser;

import java.util.Collections;
import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
        int line();
        int column();
    }

    public interface ExprVisitor<R> {
        R visitNumberLiteral(NumberLiteral expr);
        R visitStringLiteral(StringLiteral expr);
        R visitIdentifier(Identifier expr);
        R visitMember(Member expr);
        R visitFieldAccess(FieldAccess expr);
        R visitCall(Call expr);
        R visitMethodCall(MethodCall expr);
        R visitTypeInstantiation(TypeInstantiation expr);
        R visitBinary(Binary expr);
        R visitUnary(Unary expr);
        R visitTernary(Ternary expr);
        R visitHistoryAccess(HistoryAccess expr);
        R visitSwitch(Switch expr);
        R visitArrayLiteral(ArrayLiteral expr);
    }

    // -------------------------
    // Literals and names
    // -------------------------

    public static final class NumberLiteral extends SourceNode implements ExprInterface {
        public final double value;
        public final String lexeme;

        public NumberLiteral(double value, String lexeme, int line, int column) {
            super(line, column);
            this.value = value;
            this.lexeme = lexeme;
        }

        public boolean isIntegral() {
            return !Double.isInfinite(value) && value == Math.rint(value);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNumberLiteral(this);
        }
    }

    public static final class StringLiteral extends SourceNode implements ExprInterface {
        public final String value;

        public StringLiteral(String value, int line, int column) {
            super(line, column);
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitStringLiteral(this);
        }
    }

    public static final class Identifier extends SourceNode implements ExprInterface {
        public final String name;

        public Identifier(String name, int line, int column) {
            super(line, column);
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    /** A dotted name that is not called, e.g. color.red, syminfo.ticker, this.count. */
    public static final class Member extends SourceNode implements ExprInterface {
        public final String path;

        public Member(String path, int line, int column) {
            super(line, column);
            this.path = path;
        }

        public String root() {
            int dot = path.indexOf('.');
            return dot < 0 ? path : path.substring(0, dot);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMember(this);
        }
    }

    /** Field read on an arbitrary expression, e.g. make().value. */
    public static final class FieldAccess extends SourceNode implements ExprInterface {
        public final ExprInterface object;
        public final String field;

        public FieldAccess(ExprInterface object, String field, int line, int column) {
            super(line, column);
            this.object = object;
            this.field = field;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFieldAccess(this);
        }
    }

    // -------------------------
    // Calls
    // -------------------------

    /** One call argument; {@code name} is null for positional arguments. */
    public static final class Argument {
        public final String name;
        public final ExprInterface value;

        public Argument(String name, ExprInterface value) {
            this.name = name;
            this.value = value;
        }

        public boolean isNamed() {
            return name != null;
        }
    }

    public static final class Call extends SourceNode implements ExprInterface {
        public final String callee;
        public final List<Argument> args;
        public final List<String> typeArgs; // array.new<float>(...)

        public Call(String callee, List<Argument> args, List<String> typeArgs, int line, int column) {
            super(line, column);
            this.callee = callee;
            this.args = Collections.unmodifiableList(args);
            this.typeArgs = typeArgs == null ? Collections.emptyList() : Collections.unmodifiableList(typeArgs);
        }

        public boolean isGeneric() {
            return !typeArgs.isEmpty();
        }

        public ExprInterface positional(int index) {
            int seen = 0;
            for (Argument a : args) {
                if (a.isNamed()) continue;
                if (seen++ == index) return a.value;
            }
            return null;
        }

        public ExprInterface named(String name) {
            for (Argument a : args) {
                if (name.equals(a.name)) return a.value;
            }
            return null;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    /** receiver.method(args) where receiver is a value rather than a namespace. */
    public static final class MethodCall extends SourceNode implements ExprInterface {
        public final ExprInterface receiver;
        public final String method;
        public final List<Argument> args;

        public MethodCall(ExprInterface receiver, String method, List<Argument> args, int line, int column) {
            super(line, column);
            this.receiver = receiver;
            this.method = method;
            this.args = Collections.unmodifiableList(args);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMethodCall(this);
        }
    }

    /** TypeName.new(args) for a user-declared type. */
    public static final class TypeInstantiation extends SourceNode implements ExprInterface {
        public final String typeName;
        public final List<Argument> args;

        public TypeInstantiation(String typeName, List<Argument> args, int line, int column) {
            super(line, column);
            this.typeName = typeName;
            this.args = Collections.unmodifiableList(args);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitTypeInstantiation(this);
        }
    }

    // -------------------------
    // Operators
    // -------------------------

    public static final class Binary extends SourceNode implements ExprInterface {
        public final ExprInterface left;
        public final String operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, String operator, ExprInterface right, int line, int column) {
            super(line, column);
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    public static final class Unary extends SourceNode implements ExprInterface {
        public final String operator;
        public final ExprInterface operand;

        public Unary(String operator, ExprInterface operand, int line, int column) {
            super(line, column);
            this.operator = operator;
            this.operand = operand;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    public static final class Ternary extends SourceNode implements ExprInterface {
        public final ExprInterface condition;
        public final ExprInterface thenBranch;
        public final ExprInterface elseBranch;

        public Ternary(ExprInterface condition, ExprInterface thenBranch, ExprInterface elseBranch, int line, int column) {
            super(line, column);
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitTernary(this);
        }
    }

    /** base[offset]: the value of base {@code offset} bars ago. */
    public static final class HistoryAccess extends SourceNode implements ExprInterface {
        public final ExprInterface base;
        public final ExprInterface offset;

        public HistoryAccess(ExprInterface base, ExprInterface offset, int line, int column) {
            super(line, column);
            this.base = base;
            this.offset = offset;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitHistoryAccess(this);
        }
    }

    // -------------------------
    // Compound values
    // -------------------------

    /** One arm of a switch; {@code match} is null for the default arm. */
    public static final class SwitchArm {
        public final ExprInterface match;
        public final ExprInterface result;

        public SwitchArm(ExprInterface match, ExprInterface result) {
            this.match = match;
            this.result = result;
        }

        public boolean isDefault() {
            return match == null;
        }
    }

    public static final class Switch extends SourceNode implements ExprInterface {
        public final ExprInterface subject; // null for condition-only switches
        public final List<SwitchArm> arms;

        public Switch(ExprInterface subject, List<SwitchArm> arms, int line, int column) {
            super(line, column);
            this.subject = subject;
            this.arms = Collections.unmodifiableList(arms);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSwitch(this);
        }
    }

    public static final class ArrayLiteral extends SourceNode implements ExprInterface {
        public final List<ExprInterface> elements;

        public ArrayLiteral(List<ExprInterface> elements, int line, int column) {
            super(line, column);
            this.elements = Collections.unmodifiableList(elements);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitArrayLiteral(this);
        }
    }
}
