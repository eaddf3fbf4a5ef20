package com.gdformatter.plugins.gdscript.parser;

/**
 * Common view of parse tree nodes and leaf tokens.
 */
public interface SyntaxElement {
    /**
     * 1-based line the element starts on.
     */
    int getLine();

    /**
     * 1-based line the element ends on.
     */
    int getEndLine();
}
