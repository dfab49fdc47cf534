package com.elara.pine.semantic;

public final class SemanticWarning {
    private final String message;
    private final int line;
    private final int column;
    private final String context;

    public SemanticWarning(String message, int line, int column, String context) {
        this.message = message;
        this.line = line;
        this.column = column;
        this.context = context;
    }

    public String message() { return message; }
    public int line() { return line; }
    public int column() { return column; }
    public String context() { return context; }

    @Override
    public String toString() {
        return "line " + line + ", column " + column + ": " + message;
    }
}
