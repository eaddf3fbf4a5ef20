package com.gdformatter.plugins.gdscript.format;

/**
 * Text placed around an expression and the source lines the first and last
 * rendered line are anchored to.
 */
public final class ExpressionContext {
    private final String prefix;
    private final int prefixLine;
    private final String suffix;
    private final int suffixLine;

    public ExpressionContext(String prefix, int prefixLine, String suffix, int suffixLine) {
        this.prefix = prefix;
        this.prefixLine = prefixLine;
        this.suffix = suffix;
        this.suffixLine = suffixLine;
    }

    public String getPrefix() { return prefix; }
    public int getPrefixLine() { return prefixLine; }
    public String getSuffix() { return suffix; }
    public int getSuffixLine() { return suffixLine; }
}
