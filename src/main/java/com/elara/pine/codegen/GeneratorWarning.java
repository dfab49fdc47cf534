package com.elara.pine.codegen;

/** A construct the generator could not translate and left out of the output. */
public final class GeneratorWarning {
    private final String message;
    private final int line;
    private final int column;

    public GeneratorWarning(String message, int line, int column) {
        this.message = message;
        this.line = line;
        this.column = column;
    }

    public String message() { return message; }
    public int line() { return line; }
    public int column() { return column; }

    @Override
    public String toString() {
        return "line " + line + ": " + message;
    }
}
