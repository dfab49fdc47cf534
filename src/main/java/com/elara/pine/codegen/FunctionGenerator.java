package com.elara.pine.codegen;

import java.util.ArrayList;
import java.util.List;

import com.elara.pine.parser.Statement;
import com.elara.pine.parser.Statement.Stmt;

/** Emits user functions in place and user types as an interface plus a namespace object. */
public class FunctionGenerator {

    private final GeneratorContext ctx;
    private final EmissionState state;
    private final CodeWriter out;
    private final ExpressionGenerator exprs;
    private final StatementGenerator statements;

    FunctionGenerator(GeneratorContext ctx, EmissionState state, CodeWriter out,
                      ExpressionGenerator exprs, StatementGenerator statements) {
        this.ctx = ctx;
        this.state = state;
        this.out = out;
        this.exprs = exprs;
        this.statements = statements;
    }

    public void emitFunction(Statement.FunctionDeclaration fn) {
        List<String> params = new ArrayList<>();
        for (Statement.Parameter p : fn.params) {
            String param = Identifiers.sanitize(p.name) + ": any";
            if (p.defaultValue != null) param += " = " + exprs.generate(p.defaultValue);
            params.add(param);
        }
        String name = Identifiers.sanitize(fn.name);
        state.declare(name);
        out.line("function " + name + "(" + String.join(", ", params) + "): any {");
        emitBody(fn.body, fn.params);
        out.line("}");
    }

    /**
     * Emits a function or method body; the value of the final statement is returned.
     */
    private void emitBody(Statement.Block body, List<Statement.Parameter> params) {
        out.indent();
        state.enterBlock();
        for (Statement.Parameter p : params) {
            state.declare(Identifiers.sanitize(p.name));
        }
        List<Stmt> stmts = body == null ? new ArrayList<Stmt>() : body.statements;
        int last = stmts.size() - 1;
        while (last >= 0 && stmts.get(last) instanceof Statement.Comment) last--;
        for (int i = 0; i < stmts.size(); i++) {
            Stmt s = stmts.get(i);
            if (i == last && s instanceof Statement.ExprStmt) {
                String value = exprs.generate(((Statement.ExprStmt) s).expression);
                if (!value.isEmpty()) out.line("return " + value + ";");
            } else {
                s.accept(statements);
                if (i == last && s instanceof Statement.Declaration) {
                    out.line("return " + Identifiers.sanitize(((Statement.Declaration) s).name) + ";");
                }
            }
        }
        state.exitBlock();
        out.dedent();
    }

    public void emitTypes() {
        out.line("// User-defined types");
        for (TypeInfo type : ctx.types().values()) {
            String export = type.isExported() ? "export " : "";

            out.line(export + "interface " + type.name() + " {");
            out.indent();
            for (TypeInfo.FieldInfo f : type.fields()) {
                out.line(f.name + ": " + TypeMapper.toTarget(f.typeName, ctx.types()) + ";");
            }
            out.dedent();
            out.line("}");
            out.blank();

            out.line(export + "const " + type.name() + " = {");
            out.indent();
            List<String> params = new ArrayList<>();
            List<String> names = new ArrayList<>();
            for (TypeInfo.FieldInfo f : type.fields()) {
                String def = f.defaultValue != null ? exprs.generate(f.defaultValue) : TypeMapper.defaultValue(f.typeName);
                params.add(f.name + ": " + TypeMapper.toTarget(f.typeName, ctx.types()) + " = " + def);
                names.add(f.name);
            }
            out.line("new: (" + String.join(", ", params) + "): " + type.name() + " => ({");
            out.indent();
            out.line(String.join(", ", names) + ",");
            out.dedent();
            out.line("}),");
            for (MethodInfo m : ctx.methodsOf(type.name())) {
                emitMethod(m, type.name());
            }
            out.dedent();
            out.line("};");
            out.blank();
        }
    }

    private void emitMethod(MethodInfo method, String typeName) {
        String self = method.selfName() == null ? "self" : IdentifierMapper.translate(method.selfName(), ctx.variables());
        List<String> params = new ArrayList<>();
        params.add(self + ": " + typeName);
        for (Statement.Parameter p : method.params()) {
            String param = Identifiers.sanitize(p.name) + ": " + TypeMapper.toTarget(p.typeName, ctx.types());
            if (p.defaultValue != null) param += " = " + exprs.generate(p.defaultValue);
            params.add(param);
        }
        out.line(method.name() + ": (" + String.join(", ", params) + "): any => {");
        exprs.setReceiverType(typeName);
        try {
            emitBody(method.body(), method.params());
        } finally {
            exprs.setReceiverType(null);
        }
        out.line("},");
    }
}
