package com.elara.pine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Thrown by {@link PineTranspiler#transpile(String)} when the source has syntax or semantic errors. */
public class TranspileException extends RuntimeException {

    private final List<Diagnostic> errors;

    public TranspileException(List<Diagnostic> errors) {
        super(render(errors));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public List<Diagnostic> getErrors() {
        return errors;
    }

    private static String render(List<Diagnostic> errors) {
        StringBuilder sb = new StringBuilder("Transpile errors:");
        for (Diagnostic d : errors) {
            sb.append('\n').append(d);
        }
        return sb.toString();
    }
}
