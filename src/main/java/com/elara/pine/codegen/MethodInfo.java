package com.elara.pine.codegen;

import java.util.List;

import com.elara.pine.parser.Statement;

/** A method bound to a user type, emitted inside that type's namespace object. */
public final class MethodInfo {
    private final Statement.MethodDeclaration declaration;

    public MethodInfo(Statement.MethodDeclaration declaration) {
        this.declaration = declaration;
    }

    public String name() { return declaration.name; }
    public String boundType() { return declaration.boundType; }
    public String selfName() { return declaration.selfName; }
    public List<Statement.Parameter> params() { return declaration.params; }
    public Statement.Block body() { return declaration.body; }
    public boolean isExpressionBody() { return declaration.expressionBody; }
}
