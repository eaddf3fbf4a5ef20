package com.gdformatter.plugins.gdscript.parser;

/**
 * Lexical categories produced by {@link GdScriptTokenizer}.
 */
public enum TokenKind {
    NAME,
    NUMBER,
    STRING,
    OPERATOR,
    NEWLINE,
    INDENT,
    DEDENT,
    EOF
}
