package com.gdformatter.plugins.gdscript.parser;

/**
 * A comment found while tokenizing, with its position and whether
 * it is the only thing on its line.
 */
public final class CommentToken {
    private final String text;
    private final int line;
    private final int column;
    private final boolean standalone;

    public CommentToken(String text, int line, int column, boolean standalone) {
        this.text = text;
        this.line = line;
        this.column = column;
        this.standalone = standalone;
    }

    public String getText() { return text; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public boolean isStandalone() { return standalone; }

    @Override
    public String toString() {
        return (standalone ? "standalone" : "inline") + "@" + line + ": " + text;
    }
}
