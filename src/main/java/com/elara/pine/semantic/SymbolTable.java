package com.elara.pine.semantic;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stack of lexical scopes. Lookups walk from the innermost scope outwards; the global
 * scope is created up front and is never popped.
 */
public class SymbolTable {
    private final Deque<Scope> scopes = new ArrayDeque<>();
    private final Map<String, Symbol> all = new LinkedHashMap<>();
    private int nextScopeId = 0;

    public SymbolTable() {
        enterScope(ScopeKind.GLOBAL);
    }

    public Scope enterScope(ScopeKind kind) {
        Scope scope = new Scope(nextScopeId++, scopes.peek(), kind);
        scopes.push(scope);
        return scope;
    }

    public void exitScope() {
        if (scopes.size() > 1) {
            scopes.pop();
        }
    }

    public Scope currentScope() {
        return scopes.peek();
    }

    public void declare(Symbol symbol) {
        currentScope().put(symbol);
        all.put(symbol.name(), symbol);
    }

    public Symbol lookup(String name) {
        for (Scope s = currentScope(); s != null; s = s.parent()) {
            Symbol found = s.get(name);
            if (found != null) return found;
        }
        return null;
    }

    public boolean isInCurrentScope(String name) {
        return currentScope().has(name);
    }

    /** Every symbol ever declared, latest declaration per name. */
    public List<Symbol> allSymbols() {
        return Collections.unmodifiableList(new ArrayList<>(all.values()));
    }

    public boolean isInsideLoop() {
        return isInside(ScopeKind.LOOP);
    }

    public boolean isInsideFunction() {
        return isInside(ScopeKind.FUNCTION);
    }

    private boolean isInside(ScopeKind kind) {
        Iterator<Scope> it = scopes.iterator();
        while (it.hasNext()) {
            if (it.next().kind() == kind) return true;
        }
        return false;
    }
}
