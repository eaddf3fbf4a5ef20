package com.gdformatter.plugins.gdscript.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Line splitting shared by the parser and the formatter, so that both
 * agree on what "line N" means.
 */
public final class SourceLines {

    private SourceLines() {
    }

    /**
     * Splits on line terminators. A terminator at the very end does not start an extra line.
     */
    public static List<String> split(String source) {
        if (source.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> lines = new ArrayList<>(Arrays.asList(source.split("\r?\n", -1)));
        if (lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    /**
     * Same as {@link #split(String)} but 1-based: index 0 holds an empty placeholder.
     */
    public static List<String> splitOneBased(String source) {
        List<String> lines = new ArrayList<>();
        lines.add("");
        lines.addAll(split(source));
        return lines;
    }

    public static int count(String source) {
        return split(source).size();
    }
}
