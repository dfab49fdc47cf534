package com.elara.pine.parser;

/** A lexical or grammatical problem found while reading the source. */
public final class SyntaxError {
    public final String message;
    public final int line;
    public final int column;

    public SyntaxError(String message, int line, int column) {
        this.message = message;
        this.line = line;
        this.column = column;
    }

    @Override
    public String toString() {
        return "[line " + line + ", column " + column + "] " + message;
    }
}
