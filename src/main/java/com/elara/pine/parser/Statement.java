package com.elara.pine.parser;

import java.util.Collections;
import java.util.List;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);
        int line();
        int column();
    }

    public interface StmtVisitor {
        void visitExprStmt(ExprStmt stmt);
        void visitDeclaration(Declaration stmt);
        void visitReassignment(Reassignment stmt);
        void visitBlock(Block stmt);
        void visitIf(If stmt);
        void visitForRange(ForRange stmt);
        void visitForIn(ForIn stmt);
        void visitWhile(While stmt);
        void visitTupleDestructuring(TupleDestructuring stmt);
        void visitBreak(Break stmt);
        void visitContinue(Continue stmt);
        void visitComment(Comment stmt);
        void visitFunctionDeclaration(FunctionDeclaration stmt);
        void visitTypeDeclaration(TypeDeclaration stmt);
        void visitMethodDeclaration(MethodDeclaration stmt);
        void visitImport(ImportStatement stmt);
        void visitIndicatorDeclaration(IndicatorDeclaration stmt);
        void visitLibraryDeclaration(LibraryDeclaration stmt);
    }

    /** Declaration keyword in front of a binding. */
    public enum Qualifier {
        NONE,
        VAR,
        VARIP
    }

    public static final class ExprStmt extends SourceNode implements Stmt {
        public final Expr.ExprInterface expression;
        public ExprStmt(Expr.ExprInterface expression, int line, int column) {
            super(line, column);
            this.expression = expression;
        }
        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }
    }

    /** name = value, optionally with var/varip and a declared type. */
    public static final class Declaration extends SourceNode implements Stmt {
        public final String name;
        public final String typeName;
        public final Qualifier qualifier;
        public final Expr.ExprInterface initializer;
        public Declaration(String name, String typeName, Qualifier qualifier, Expr.ExprInterface initializer, int line, int column) {
            super(line, column);
            this.name = name;
            this.typeName = typeName;
            this.qualifier = qualifier;
            this.initializer = initializer;
        }
        public void accept(StmtVisitor visitor) { visitor.visitDeclaration(this); }
    }

    /**
     * target := value. Compound forms (x += v) are stored with the expanded value
     * (x + v) and the original operator in {@code compoundOperator}.
     */
    public static final class Reassignment extends SourceNode implements Stmt {
        public final Expr.ExprInterface target;
        public final Expr.ExprInterface value;
        public final String compoundOperator;
        public Reassignment(Expr.ExprInterface target, Expr.ExprInterface value, String compoundOperator, int line, int column) {
            super(line, column);
            this.target = target;
            this.value = value;
            this.compoundOperator = compoundOperator;
        }
        public String targetName() {
            return target instanceof Expr.Identifier ? ((Expr.Identifier) target).name : null;
        }
        public void accept(StmtVisitor visitor) { visitor.visitReassignment(this); }
    }

    public static final class Block extends SourceNode implements Stmt {
        public final List<Stmt> statements;
        public Block(List<Stmt> statements, int line, int column) {
            super(line, column);
            this.statements = Collections.unmodifiableList(statements);
        }
        public void accept(StmtVisitor visitor) { visitor.visitBlock(this); }
    }

    public static final class If extends SourceNode implements Stmt {
        public final Expr.ExprInterface condition;
        public final Block thenBranch;
        public final Stmt elseBranch; // Block, If (else if) or null
        public If(Expr.ExprInterface condition, Block thenBranch, Stmt elseBranch, int line, int column) {
            super(line, column);
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
        public void accept(StmtVisitor visitor) { visitor.visitIf(this); }
    }

    /** for i = start to end [by step]; both bounds inclusive. */
    public static final class ForRange extends SourceNode implements Stmt {
        public final String variable;
        public final Expr.ExprInterface start;
        public final Expr.ExprInterface end;
        public final Expr.ExprInterface step;
        public final Block body;
        public ForRange(String variable, Expr.ExprInterface start, Expr.ExprInterface end, Expr.ExprInterface step, Block body, int line, int column) {
            super(line, column);
            this.variable = variable;
            this.start = start;
            this.end = end;
            this.step = step;
            this.body = body;
        }
        public void accept(StmtVisitor visitor) { visitor.visitForRange(this); }
    }

    /** for item in seq, or for [index, item] in seq. */
    public static final class ForIn extends SourceNode implements Stmt {
        public final String indexVariable;
        public final String itemVariable;
        public final Expr.ExprInterface iterable;
        public final Block body;
        public ForIn(String indexVariable, String itemVariable, Expr.ExprInterface iterable, Block body, int line, int column) {
            super(line, column);
            this.indexVariable = indexVariable;
            this.itemVariable = itemVariable;
            this.iterable = iterable;
            this.body = body;
        }
        public void accept(StmtVisitor visitor) { visitor.visitForIn(this); }
    }

    public static final class While extends SourceNode implements Stmt {
        public final Expr.ExprInterface condition;
        public final Block body;
        public While(Expr.ExprInterface condition, Block body, int line, int column) {
            super(line, column);
            this.condition = condition;
            this.body = body;
        }
        public void accept(StmtVisitor visitor) { visitor.visitWhile(this); }
    }

    public static final class TupleDestructuring extends SourceNode implements Stmt {
        public final List<String> names;
        public final Expr.ExprInterface initializer;
        public TupleDestructuring(List<String> names, Expr.ExprInterface initializer, int line, int column) {
            super(line, column);
            this.names = Collections.unmodifiableList(names);
            this.initializer = initializer;
        }
        public void accept(StmtVisitor visitor) { visitor.visitTupleDestructuring(this); }
    }

    public static final class Break extends SourceNode implements Stmt {
        public Break(int line, int column) { super(line, column); }
        public void accept(StmtVisitor visitor) { visitor.visitBreak(this); }
    }

    public static final class Continue extends SourceNode implements Stmt {
        public Continue(int line, int column) { super(line, column); }
        public void accept(StmtVisitor visitor) { visitor.visitContinue(this); }
    }

    public static final class Comment extends SourceNode implements Stmt {
        public final String text;
        public Comment(String text, int line, int column) {
            super(line, column);
            this.text = text;
        }
        public void accept(StmtVisitor visitor) { visitor.visitComment(this); }
    }

    // -------------------------
    // Declarations
    // -------------------------

    public static final class Parameter {
        public final String name;
        public final String typeName; // may be null
        public final Expr.ExprInterface defaultValue; // may be null
        public Parameter(String name, String typeName, Expr.ExprInterface defaultValue) {
            this.name = name;
            this.typeName = typeName;
            this.defaultValue = defaultValue;
        }
        public boolean isOptional() { return defaultValue != null; }
    }

    public static final class FunctionDeclaration extends SourceNode implements Stmt {
        public final String name;
        public final List<Parameter> params;
        public final Block body;
        public final boolean expressionBody; // f(x) => x * 2
        public final boolean exported;
        public FunctionDeclaration(String name, List<Parameter> params, Block body, boolean expressionBody, boolean exported, int line, int column) {
            super(line, column);
            this.name = name;
            this.params = Collections.unmodifiableList(params);
            this.body = body;
            this.expressionBody = expressionBody;
            this.exported = exported;
        }
        public void accept(StmtVisitor visitor) { visitor.visitFunctionDeclaration(this); }
    }

    public static final class Field {
        public final String typeName;
        public final String name;
        public final Expr.ExprInterface defaultValue; // may be null
        public Field(String typeName, String name, Expr.ExprInterface defaultValue) {
            this.typeName = typeName;
            this.name = name;
            this.defaultValue = defaultValue;
        }
    }

    public static final class TypeDeclaration extends SourceNode implements Stmt {
        public final String name;
        public final List<Field> fields;
        public final boolean exported;
        public TypeDeclaration(String name, List<Field> fields, boolean exported, int line, int column) {
            super(line, column);
            this.name = name;
            this.fields = Collections.unmodifiableList(fields);
            this.exported = exported;
        }
        public void accept(StmtVisitor visitor) { visitor.visitTypeDeclaration(this); }
    }

    /** method name(Type self, params) => body; bound to {@code boundType}. */
    public static final class MethodDeclaration extends SourceNode implements Stmt {
        public final String name;
        public final String boundType;
        public final String selfName;
        public final List<Parameter> params; // without the receiver
        public final Block body;
        public final boolean expressionBody;
        public final boolean exported;
        public MethodDeclaration(String name, String boundType, String selfName, List<Parameter> params, Block body,
                                 boolean expressionBody, boolean exported, int line, int column) {
            super(line, column);
            this.name = name;
            this.boundType = boundType;
            this.selfName = selfName;
            this.params = Collections.unmodifiableList(params);
            this.body = body;
            this.expressionBody = expressionBody;
            this.exported = exported;
        }
        public void accept(StmtVisitor visitor) { visitor.visitMethodDeclaration(this); }
    }

    /** import publisher/library/version as alias */
    public static final class ImportStatement extends SourceNode implements Stmt {
        public final String publisher;
        public final String library;
        public final int version;
        public final String alias;
        public ImportStatement(String publisher, String library, int version, String alias, int line, int column) {
            super(line, column);
            this.publisher = publisher;
            this.library = library;
            this.version = version;
            this.alias = alias;
        }
        public void accept(StmtVisitor visitor) { visitor.visitImport(this); }
    }

    public static final class IndicatorDeclaration extends SourceNode implements Stmt {
        public final List<Expr.Argument> args;
        public IndicatorDeclaration(List<Expr.Argument> args, int line, int column) {
            super(line, column);
            this.args = Collections.unmodifiableList(args);
        }
        public void accept(StmtVisitor visitor) { visitor.visitIndicatorDeclaration(this); }
    }

    public static final class LibraryDeclaration extends SourceNode implements Stmt {
        public final List<Expr.Argument> args;
        public LibraryDeclaration(List<Expr.Argument> args, int line, int column) {
            super(line, column);
            this.args = Collections.unmodifiableList(args);
        }
        public void accept(StmtVisitor visitor) { visitor.visitLibraryDeclaration(this); }
    }
}
