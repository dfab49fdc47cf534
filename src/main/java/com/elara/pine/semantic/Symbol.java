package com.elara.pine.semantic;

/** A declared name. Builtins are declared at line 0, column 0. */
public final class Symbol {
    private final String name;
    private final SymbolKind kind;
    private final PineType type;
    private final boolean constant;
    private final boolean reassignable;
    private final int line;
    private final int column;
    private Scope scope;

    public Symbol(String name, SymbolKind kind, PineType type, boolean constant, boolean reassignable, int line, int column) {
        this.name = name;
        this.kind = kind;
        this.type = type;
        this.constant = constant;
        this.reassignable = reassignable;
        this.line = line;
        this.column = column;
    }

    void attach(Scope scope) {
        this.scope = scope;
    }

    public String name() { return name; }
    public SymbolKind kind() { return kind; }
    public PineType type() { return type; }
    public boolean isConst() { return constant; }
    public boolean isSeries() { return type.isSeries(); }
    public boolean isReassignable() { return reassignable; }
    public int line() { return line; }
    public int column() { return column; }
    public Scope scope() { return scope; }

    public boolean isBuiltin() {
        return line == 0 && column == 0;
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " " + name + ": " + type;
    }
}
