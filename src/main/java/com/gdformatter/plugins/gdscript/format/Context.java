package com.gdformatter.plugins.gdscript.format;

import java.util.Collections;
import java.util.List;

import com.gdformatter.plugins.gdscript.comments.CommentTable;
import com.gdformatter.plugins.gdscript.parser.GdScriptTokenizer;

/**
 * Immutable formatting state handed down the tree. A child context is one
 * indentation level deeper and starts from a new cursor; everything else
 * is shared with the parent.
 */
public final class Context {
    private final int singleIndentSize;
    private final String singleIndentString;
    private final int maxLineLength;
    private final int indentLevel;
    private final int previouslyProcessedLineNumber;
    private final List<String> sourceLines;
    private final CommentTable standaloneComments;
    private final CommentTable inlineComments;
    private final BlankLinePolicies blankLinePolicies;

    private Context(Builder builder) {
        this.singleIndentSize = builder.singleIndentSize;
        this.singleIndentString = builder.singleIndentString;
        this.maxLineLength = builder.maxLineLength;
        this.indentLevel = builder.indentLevel;
        this.previouslyProcessedLineNumber = builder.previouslyProcessedLineNumber;
        this.sourceLines = builder.sourceLines;
        this.standaloneComments = builder.standaloneComments;
        this.inlineComments = builder.inlineComments;
        this.blankLinePolicies = builder.blankLinePolicies;
    }

    public Context createChildContext(int previouslyProcessedLine) {
        return toBuilder()
                .indentLevel(indentLevel + 1)
                .previouslyProcessedLineNumber(previouslyProcessedLine)
                .build();
    }

    public String getIndentString() {
        return singleIndentString.repeat(indentLevel);
    }

    public String indentStringFor(int level) {
        return singleIndentString.repeat(level);
    }

    /**
     * Display width of a given indentation level, tabs counting as
     * {@link GdScriptTokenizer#TAB_WIDTH} columns.
     */
    public int indentWidthFor(int level) {
        return level * singleIndentSize;
    }

    /**
     * Raw indentation width of a source line, tabs counting as
     * {@link GdScriptTokenizer#TAB_WIDTH} columns.
     */
    public int sourceIndentWidth(int line) {
        String text = getSourceLine(line);
        int width = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width += GdScriptTokenizer.TAB_WIDTH;
            } else {
                break;
            }
        }
        return width;
    }

    /**
     * 1-based source line, or an empty string past either end.
     */
    public String getSourceLine(int line) {
        if (line < 1 || line >= sourceLines.size()) {
            return "";
        }
        return sourceLines.get(line);
    }

    public int getSourceLineCount() {
        return sourceLines.size() - 1;
    }

    public int getSingleIndentSize() { return singleIndentSize; }
    public String getSingleIndentString() { return singleIndentString; }
    public int getMaxLineLength() { return maxLineLength; }
    public int getIndentLevel() { return indentLevel; }
    public int getPreviouslyProcessedLineNumber() { return previouslyProcessedLineNumber; }
    public CommentTable getStandaloneComments() { return standaloneComments; }
    public CommentTable getInlineComments() { return inlineComments; }
    public BlankLinePolicies getBlankLinePolicies() { return blankLinePolicies; }

    public Builder toBuilder() {
        return new Builder()
                .singleIndentSize(singleIndentSize)
                .singleIndentString(singleIndentString)
                .maxLineLength(maxLineLength)
                .indentLevel(indentLevel)
                .previouslyProcessedLineNumber(previouslyProcessedLineNumber)
                .sourceLines(sourceLines)
                .standaloneComments(standaloneComments)
                .inlineComments(inlineComments)
                .blankLinePolicies(blankLinePolicies);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int singleIndentSize = GdScriptTokenizer.TAB_WIDTH;
        private String singleIndentString = "\t";
        private int maxLineLength = FormattingOptions.DEFAULT_MAX_LINE_LENGTH;
        private int indentLevel;
        private int previouslyProcessedLineNumber;
        private List<String> sourceLines = List.of("");
        private CommentTable standaloneComments = CommentTable.empty(0);
        private CommentTable inlineComments = CommentTable.empty(0);
        private BlankLinePolicies blankLinePolicies = BlankLinePolicies.defaults();

        public Builder singleIndentSize(int singleIndentSize) {
            this.singleIndentSize = singleIndentSize;
            return this;
        }

        public Builder singleIndentString(String singleIndentString) {
            this.singleIndentString = singleIndentString;
            return this;
        }

        public Builder maxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
            return this;
        }

        public Builder indentLevel(int indentLevel) {
            this.indentLevel = indentLevel;
            return this;
        }

        public Builder previouslyProcessedLineNumber(int previouslyProcessedLineNumber) {
            this.previouslyProcessedLineNumber = previouslyProcessedLineNumber;
            return this;
        }

        /**
         * @param sourceLines 1-based lines; index 0 is a placeholder
         */
        public Builder sourceLines(List<String> sourceLines) {
            this.sourceLines = Collections.unmodifiableList(sourceLines);
            return this;
        }

        public Builder standaloneComments(CommentTable standaloneComments) {
            this.standaloneComments = standaloneComments;
            return this;
        }

        public Builder inlineComments(CommentTable inlineComments) {
            this.inlineComments = inlineComments;
            return this;
        }

        public Builder blankLinePolicies(BlankLinePolicies blankLinePolicies) {
            this.blankLinePolicies = blankLinePolicies;
            return this;
        }

        public Context build() {
            if (singleIndentString.isEmpty()) {
                throw new IllegalArgumentException("Indent unit must not be empty");
            }
            return new Context(this);
        }
    }
}
