package com.elara.pine.codegen;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Records which runtime facilities the emitted body refers to, so the main import
 * line can be patched once the body is complete.
 */
public final class ImportTracker {

    /** Emission order of value imports in the main import line. */
    private static final List<String> VALUE_IMPORTS = Collections.unmodifiableList(Arrays.asList(
            "ta", "taCore", "math", "array", "na", "nz"));

    private static final Set<String> NAMESPACES = new LinkedHashSet<>(Arrays.asList("ta", "taCore", "math", "array"));
    private static final Set<String> FUNCTIONS = new LinkedHashSet<>(Arrays.asList("na", "nz"));

    private final Set<String> used = new LinkedHashSet<>();

    /** Tracks the namespace of a dotted call such as {@code ta.sma}. */
    public void trackNamespace(String qualifiedName) {
        if (qualifiedName == null) return;
        int dot = qualifiedName.indexOf('.');
        if (dot <= 0) return;
        String ns = qualifiedName.substring(0, dot);
        if (NAMESPACES.contains(ns)) used.add(ns);
    }

    public void trackFunction(String name) {
        if (FUNCTIONS.contains(name)) used.add(name);
    }

    public boolean isUsed(String name) {
        return used.contains(name);
    }

    /** Used value imports in their fixed emission order. */
    public List<String> imports() {
        List<String> out = new ArrayList<>();
        for (String name : VALUE_IMPORTS) {
            if (used.contains(name)) out.add(name);
        }
        return out;
    }
}
