package com.gdformatter.plugins.gdscript.format;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of rendering a construct: its lines in document order and the last
 * source line it consumed. Callers resume their cursor from the latter.
 */
public final class Outcome {
    private final List<FormattedLine> lines;
    private final int lastProcessedLine;

    public Outcome(List<FormattedLine> lines, int lastProcessedLine) {
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
        this.lastProcessedLine = lastProcessedLine;
    }

    public List<FormattedLine> getLines() {
        return lines;
    }

    public int getLastProcessedLine() {
        return lastProcessedLine;
    }

    /**
     * Appends another outcome, taking over its last processed line.
     */
    public Outcome followedBy(Outcome next) {
        List<FormattedLine> combined = new ArrayList<>(lines);
        combined.addAll(next.lines);
        return new Outcome(combined, next.lastProcessedLine);
    }
}
