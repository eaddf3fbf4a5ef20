package com.gdformatter.plugins.gdscript.parser;

/**
 * Raised when the input is not valid in the supported GDScript subset.
 */
public class GdScriptSyntaxException extends Exception {
    private final int line;
    private final int column;

    public GdScriptSyntaxException(String message, int line, int column) {
        super(message + " (line " + line + ", column " + column + ")");
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
