package com.gdformatter.plugins.gdscript.format;

/**
 * Caller-facing knobs of a format run.
 */
public final class FormattingOptions {
    public static final int DEFAULT_MAX_LINE_LENGTH = 100;

    private final int maxLineLength;
    private final Integer spacesForIndent;
    private final BlankLinePolicies blankLinePolicies;

    /**
     * @param spacesForIndent spaces per indent unit, or null to indent with tabs
     */
    public FormattingOptions(int maxLineLength, Integer spacesForIndent, BlankLinePolicies blankLinePolicies) {
        this.maxLineLength = maxLineLength;
        this.spacesForIndent = spacesForIndent;
        this.blankLinePolicies = blankLinePolicies;
    }

    public static FormattingOptions defaults() {
        return new FormattingOptions(DEFAULT_MAX_LINE_LENGTH, null, BlankLinePolicies.defaults());
    }

    public static FormattingOptions withLineLength(int maxLineLength) {
        return new FormattingOptions(maxLineLength, null, BlankLinePolicies.defaults());
    }

    public int getMaxLineLength() { return maxLineLength; }
    public Integer getSpacesForIndent() { return spacesForIndent; }
    public BlankLinePolicies getBlankLinePolicies() { return blankLinePolicies; }

    public boolean usesTabs() {
        return spacesForIndent == null;
    }
}
