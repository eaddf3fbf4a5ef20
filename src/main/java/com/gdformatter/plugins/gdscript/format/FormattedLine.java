package com.gdformatter.plugins.gdscript.format;

import java.util.Objects;

/**
 * One rendered output line. The source line number anchors comment
 * reattachment; synthetic lines (blank spacers, reinserted comments) have
 * none and never attract comments. Indentation and body are kept apart
 * until the text is joined.
 */
public final class FormattedLine {
    private final Integer sourceLine;
    private final String indent;
    private final String body;

    private FormattedLine(Integer sourceLine, String indent, String body) {
        this.sourceLine = sourceLine;
        this.indent = Objects.requireNonNull(indent, "indent");
        this.body = Objects.requireNonNull(body, "body");
    }

    public static FormattedLine of(int sourceLine, String indent, String body) {
        return new FormattedLine(sourceLine, indent, body);
    }

    public static FormattedLine synthetic(String indent, String body) {
        return new FormattedLine(null, indent, body);
    }

    public static FormattedLine blank() {
        return new FormattedLine(null, "", "");
    }

    public Integer getSourceLine() { return sourceLine; }
    public String getIndent() { return indent; }
    public String getBody() { return body; }

    public boolean hasSourceLine() {
        return sourceLine != null;
    }

    public String getText() {
        return indent + body;
    }

    public boolean isBlank() {
        return getText().isBlank();
    }

    public FormattedLine withIndent(String newIndent) {
        return new FormattedLine(sourceLine, newIndent, body);
    }

    public FormattedLine withBody(String newBody) {
        return new FormattedLine(sourceLine, indent, newBody);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FormattedLine)) return false;
        FormattedLine that = (FormattedLine) o;
        return Objects.equals(sourceLine, that.sourceLine) && indent.equals(that.indent) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceLine, indent, body);
    }

    @Override
    public String toString() {
        return (sourceLine == null ? "-" : sourceLine.toString()) + ": " + getText();
    }
}
