package com.elara.pine.parser;

/** Base of every syntax tree node: the source position it was parsed from. */
public abstract class SourceNode {
    public final int line;
    public final int column;

    protected SourceNode(int line, int column) {
        this.line = line;
        this.column = column;
    }

    public int line() { return line; }
    public int column() { return column; }
}
