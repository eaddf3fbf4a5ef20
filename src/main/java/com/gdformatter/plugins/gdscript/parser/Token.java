package com.gdformatter.plugins.gdscript.parser;

import java.util.Objects;

/**
 * A leaf of the parse tree: kind, literal source text and position.
 */
public final class Token implements SyntaxElement {
    private final TokenKind kind;
    private final String value;
    private final int line;
    private final int column;
    private final int endLine;

    public Token(TokenKind kind, String value, int line, int column) {
        this(kind, value, line, column, line);
    }

    public Token(TokenKind kind, String value, int line, int column, int endLine) {
        this.kind = kind;
        this.value = value;
        this.line = line;
        this.column = column;
        this.endLine = endLine;
    }

    public TokenKind getKind() { return kind; }
    public String getValue() { return value; }
    @Override
    public int getLine() { return line; }
    public int getColumn() { return column; }
    @Override
    public int getEndLine() { return endLine; }

    /**
     * Column right after the last character, valid for single-line tokens only.
     */
    public int getEndColumn() {
        return column + value.length();
    }

    public boolean is(TokenKind expectedKind, String expectedValue) {
        return kind == expectedKind && value.equals(expectedValue);
    }

    public boolean isOperator(String operator) {
        return is(TokenKind.OPERATOR, operator);
    }

    public boolean isKeyword(String keyword) {
        return is(TokenKind.NAME, keyword);
    }

    /**
     * Compares kind and text only, ignoring the position.
     */
    public boolean sameContent(Token other) {
        return other != null && kind == other.kind && value.equals(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token token = (Token) o;
        return line == token.line && column == token.column && endLine == token.endLine
                && kind == token.kind && value.equals(token.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, line, column, endLine);
    }

    @Override
    public String toString() {
        return kind + "(" + value + ")@" + line + ":" + column;
    }
}
