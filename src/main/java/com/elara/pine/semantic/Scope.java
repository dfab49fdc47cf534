package com.elara.pine.semantic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class Scope {
    private final int id;
    private final Scope parent;
    private final ScopeKind kind;
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();

    Scope(int id, Scope parent, ScopeKind kind) {
        this.id = id;
        this.parent = parent;
        this.kind = kind;
    }

    public int id() { return id; }
    public Scope parent() { return parent; }
    public ScopeKind kind() { return kind; }

    public Map<String, Symbol> symbols() {
        return Collections.unmodifiableMap(symbols);
    }

    void put(Symbol symbol) {
        symbols.put(symbol.name(), symbol);
        symbol.attach(this);
    }

    Symbol get(String name) {
        return symbols.get(name);
    }

    boolean has(String name) {
        return symbols.containsKey(name);
    }
}
