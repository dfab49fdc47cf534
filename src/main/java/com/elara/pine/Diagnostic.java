package com.elara.pine;

/** A positioned message from any stage of the pipeline. */
public final class Diagnostic {
    private final String message;
    private final int line;
    private final int column;

    public Diagnostic(String message, int line, int column) {
        this.message = message;
        this.line = line;
        this.column = column;
    }

    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }

    @Override
    public String toString() {
        return "Line " + line + ": " + message;
    }
}
