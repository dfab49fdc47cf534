package com.elara.pine.parser;

import java.util.Collections;
import java.util.List;

/** Statements of a source file plus every lexical and syntax error found while reading it. */
public final class ParseResult {
    private final List<Statement.Stmt> statements;
    private final List<SyntaxError> errors;

    public ParseResult(List<Statement.Stmt> statements, List<SyntaxError> errors) {
        this.statements = Collections.unmodifiableList(statements);
        this.errors = Collections.unmodifiableList(errors);
    }

    public List<Statement.Stmt> statements() { return statements; }
    public List<SyntaxError> errors() { return errors; }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
