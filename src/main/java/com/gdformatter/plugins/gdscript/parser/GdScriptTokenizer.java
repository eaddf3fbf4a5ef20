package com.gdformatter.plugins.gdscript.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Turns GDScript source into tokens, synthesizing NEWLINE, INDENT and DEDENT
 * the way an indentation based grammar expects. Blank and comment-only lines
 * never produce tokens; newlines inside brackets and after a backslash are
 * line continuations. Comments are collected on the side.
 */
public class GdScriptTokenizer {
    public static final int TAB_WIDTH = 4;

    private static final String[] OPERATORS = {
            "**=", "<<=", ">>=",
            "->", ":=", "==", "!=", "<=", ">=", "&&", "||", "**", "<<", ">>",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "..",
            "+", "-", "*", "/", "%", "<", ">", "=", "!", "~", "&", "|", "^",
            "(", ")", "[", "]", "{", "}", ",", ":", ";", ".", "$", "@"
    };

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final List<CommentToken> comments = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<Token> openBrackets = new ArrayDeque<>();

    private int pos;
    private int line = 1;
    private int lineStart;
    private boolean tokenized;

    public GdScriptTokenizer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() throws GdScriptSyntaxException {
        if (tokenized) {
            return tokens;
        }
        indents.push(0);
        boolean atLineStart = true;

        while (pos < source.length()) {
            if (atLineStart && openBrackets.isEmpty()) {
                int width = 0;
                while (pos < source.length() && (source.charAt(pos) == ' ' || source.charAt(pos) == '\t')) {
                    width += source.charAt(pos) == '\t' ? TAB_WIDTH : 1;
                    pos++;
                }
                if (pos >= source.length()) {
                    break;
                }
                char first = source.charAt(pos);
                if (first == '\n') {
                    _newLine();
                    continue;
                }
                if (first == '\r') {
                    pos++;
                    continue;
                }
                if (first == '#') {
                    _readComment();
                    continue;
                }
                _handleIndentation(width);
                atLineStart = false;
            }

            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\r') {
                pos++;
            } else if (c == '\n') {
                if (openBrackets.isEmpty()) {
                    _emitNewLine();
                    atLineStart = true;
                }
                _newLine();
            } else if (c == '#') {
                _readComment();
            } else if (c == '\\') {
                _readContinuation();
            } else if (c == '"' || c == '\'') {
                _readString(pos);
            } else if ((c == '&' || c == '^') && pos + 1 < source.length() && _isQuote(source.charAt(pos + 1))) {
                int start = pos;
                pos++;
                _readString(start);
            } else if (Character.isDigit(c) || (c == '.' && _nextIsDigit() && !_previousEndsOperand())) {
                _readNumber();
            } else if (Character.isLetter(c) || c == '_') {
                _readName();
            } else {
                _readOperator();
            }
        }

        if (!openBrackets.isEmpty()) {
            Token open = openBrackets.peek();
            throw new GdScriptSyntaxException("Unclosed '" + open.getValue() + "'", open.getLine(), open.getColumn());
        }
        _emitNewLine();
        while (indents.peek() > 0) {
            indents.pop();
            tokens.add(new Token(TokenKind.DEDENT, "", line, 1));
        }
        tokens.add(new Token(TokenKind.EOF, "", line, _column()));
        tokenized = true;
        return tokens;
    }

    /**
     * Comments seen by the last {@link #tokenize()} call, in source order.
     */
    public List<CommentToken> getComments() {
        return comments;
    }

    private void _handleIndentation(int width) throws GdScriptSyntaxException {
        int current = indents.peek();
        if (width > current) {
            indents.push(width);
            tokens.add(new Token(TokenKind.INDENT, "", line, 1));
            return;
        }
        while (width < indents.peek()) {
            indents.pop();
            tokens.add(new Token(TokenKind.DEDENT, "", line, 1));
        }
        if (width != indents.peek()) {
            throw new GdScriptSyntaxException("Unindent does not match any outer indentation level", line, _column());
        }
    }

    private void _emitNewLine() {
        if (tokens.isEmpty()) {
            return;
        }
        TokenKind last = tokens.get(tokens.size() - 1).getKind();
        if (last != TokenKind.NEWLINE && last != TokenKind.INDENT && last != TokenKind.DEDENT) {
            tokens.add(new Token(TokenKind.NEWLINE, "", line, _column()));
        }
    }

    private void _newLine() {
        pos++;
        line++;
        lineStart = pos;
    }

    private int _column() {
        return pos - lineStart + 1;
    }

    private void _readComment() {
        int start = pos;
        boolean standalone = source.substring(lineStart, start).isBlank();
        while (pos < source.length() && source.charAt(pos) != '\n') {
            pos++;
        }
        String text = source.substring(start, pos).stripTrailing();
        comments.add(new CommentToken(text, line, start - lineStart + 1, standalone));
    }

    private void _readContinuation() throws GdScriptSyntaxException {
        int next = pos + 1;
        if (next < source.length() && source.charAt(next) == '\r') {
            next++;
        }
        if (next >= source.length() || source.charAt(next) != '\n') {
            throw new GdScriptSyntaxException("Unexpected character '\\'", line, _column());
        }
        pos = next;
        _newLine();
    }

    private void _readString(int start) throws GdScriptSyntaxException {
        int startLine = line;
        int startColumn = start - lineStart + 1;
        if (source.charAt(pos) == 'r') {
            pos++;
        }
        char quote = source.charAt(pos);
        boolean triple = source.startsWith(String.valueOf(quote).repeat(3), pos);
        pos += triple ? 3 : 1;

        while (true) {
            if (pos >= source.length()) {
                throw new GdScriptSyntaxException("Unterminated string", startLine, startColumn);
            }
            char c = source.charAt(pos);
            if (c == '\\' && pos + 1 < source.length()) {
                if (source.charAt(pos + 1) == '\n') {
                    pos++;
                    _newLine();
                } else {
                    pos += 2;
                }
                continue;
            }
            if (c == '\n') {
                if (!triple) {
                    throw new GdScriptSyntaxException("Unterminated string", startLine, startColumn);
                }
                _newLine();
                continue;
            }
            if (c == quote) {
                if (!triple) {
                    pos++;
                    break;
                }
                if (source.startsWith(String.valueOf(quote).repeat(3), pos)) {
                    pos += 3;
                    break;
                }
            }
            pos++;
        }
        tokens.add(new Token(TokenKind.STRING, source.substring(start, pos), startLine, startColumn, line));
    }

    private void _readNumber() {
        int start = pos;
        int column = _column();
        if (source.startsWith("0x", pos) || source.startsWith("0X", pos)) {
            pos += 2;
            while (pos < source.length() && (Character.digit(source.charAt(pos), 16) >= 0 || source.charAt(pos) == '_')) {
                pos++;
            }
        } else if (source.startsWith("0b", pos) || source.startsWith("0B", pos)) {
            pos += 2;
            while (pos < source.length() && "01_".indexOf(source.charAt(pos)) >= 0) {
                pos++;
            }
        } else {
            _skipDigits();
            if (pos < source.length() && source.charAt(pos) == '.' && !source.startsWith("..", pos)
                    && !(pos + 1 < source.length() && Character.isLetter(source.charAt(pos + 1))
                    && source.charAt(pos + 1) != 'e')) {
                pos++;
                _skipDigits();
            }
            if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
                int mark = pos;
                pos++;
                if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                    pos++;
                }
                if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                    _skipDigits();
                } else {
                    pos = mark;
                }
            }
        }
        tokens.add(new Token(TokenKind.NUMBER, source.substring(start, pos), line, column));
    }

    private void _skipDigits() {
        while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
    }

    private void _readName() throws GdScriptSyntaxException {
        if (source.charAt(pos) == 'r' && pos + 1 < source.length() && _isQuote(source.charAt(pos + 1))) {
            _readString(pos);
            return;
        }
        int start = pos;
        int column = _column();
        while (pos < source.length() && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        tokens.add(new Token(TokenKind.NAME, source.substring(start, pos), line, column));
    }

    private void _readOperator() throws GdScriptSyntaxException {
        for (String operator : OPERATORS) {
            if (source.startsWith(operator, pos)) {
                Token token = new Token(TokenKind.OPERATOR, operator, line, _column());
                _trackBrackets(token);
                tokens.add(token);
                pos += operator.length();
                return;
            }
        }
        throw new GdScriptSyntaxException("Unexpected character '" + source.charAt(pos) + "'", line, _column());
    }

    private void _trackBrackets(Token token) throws GdScriptSyntaxException {
        String value = token.getValue();
        if (value.equals("(") || value.equals("[") || value.equals("{")) {
            openBrackets.push(token);
        } else if (value.equals(")") || value.equals("]") || value.equals("}")) {
            if (openBrackets.isEmpty()) {
                throw new GdScriptSyntaxException("Unmatched '" + value + "'", token.getLine(), token.getColumn());
            }
            String open = openBrackets.pop().getValue();
            boolean matches = (open.equals("(") && value.equals(")"))
                    || (open.equals("[") && value.equals("]"))
                    || (open.equals("{") && value.equals("}"));
            if (!matches) {
                throw new GdScriptSyntaxException("'" + value + "' does not close '" + open + "'",
                        token.getLine(), token.getColumn());
            }
        }
    }

    private boolean _nextIsDigit() {
        return pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1));
    }

    private boolean _previousEndsOperand() {
        if (tokens.isEmpty()) {
            return false;
        }
        Token previous = tokens.get(tokens.size() - 1);
        return previous.getKind() == TokenKind.NAME
                || previous.getKind() == TokenKind.NUMBER
                || previous.getKind() == TokenKind.STRING
                || previous.isOperator(")") || previous.isOperator("]") || previous.isOperator("}");
    }

    private static boolean _isQuote(char c) {
        return c == '"' || c == '\'';
    }
}
