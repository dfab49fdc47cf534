package com.elara.pine.semantic;

public final class SemanticError {
    private final SemanticErrorKind kind;
    private final String message;
    private final int line;
    private final int column;
    private final String context;

    public SemanticError(SemanticErrorKind kind, String message, int line, int column, String context) {
        this.kind = kind;
        this.message = message;
        this.line = line;
        this.column = column;
        this.context = context;
    }

    public SemanticErrorKind kind() { return kind; }
    public String message() { return message; }
    public int line() { return line; }
    public int column() { return column; }

    /** Source line the error points into, or null. */
    public String context() { return context; }

    /**
     * Human-readable rendering:
     * <pre>
     * Semantic Error [KIND] at line L, column C:
     *   message
     *
     *     L | source line
     *       |     ^
     * </pre>
     * The excerpt is only present when a context line is known.
     */
    public String format() {
        StringBuilder out = new StringBuilder();
        out.append("Semantic Error [").append(kind.name()).append("] at line ")
                .append(line).append(", column ").append(column).append(":\n");
        out.append("  ").append(message).append('\n');
        if (context != null) {
            out.append("\n    ").append(line).append(" | ").append(context).append('\n');
            out.append("      | ").append(" ".repeat(Math.max(0, column))).append("^\n");
        }
        return out.toString();
    }

    @Override
    public String toString() {
        return "[" + kind + "] line " + line + ", column " + column + ": " + message;
    }
}
