package com.gdformatter.plugins.gdscript.comments;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Comments indexed by 1-based source line. Slot 0 is unused, so the table
 * has one slot more than the source has lines; a slot holds the comment
 * text or null.
 */
public final class CommentTable {
    private final String[] slots;

    private CommentTable(String[] slots) {
        this.slots = slots;
    }

    public static CommentTable empty(int lineCount) {
        return new CommentTable(new String[lineCount + 1]);
    }

    /**
     * Builds a table from per-line values, first element being line 1.
     */
    public static CommentTable of(String... lineComments) {
        String[] slots = new String[lineComments.length + 1];
        System.arraycopy(lineComments, 0, slots, 1, lineComments.length);
        return new CommentTable(slots);
    }

    public String get(int line) {
        return slots[line];
    }

    public boolean has(int line) {
        return line > 0 && line < slots.length && slots[line] != null;
    }

    /**
     * Number of source lines covered.
     */
    public int lineCount() {
        return slots.length - 1;
    }

    /**
     * Non-null comments whose line is in {@code [from, to)}, in line order.
     * Bounds are clamped to the table.
     */
    public List<String> commentsBetween(int from, int to) {
        int start = Math.max(1, from);
        int end = Math.min(slots.length, to);
        if (start >= end) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        for (int line = start; line < end; line++) {
            if (slots[line] != null) {
                result.add(slots[line]);
            }
        }
        return result;
    }

    /**
     * True when any comment sits on a line strictly between the two bounds.
     */
    public boolean anyStrictlyBetween(int from, int to) {
        return !commentsBetween(from + 1, to).isEmpty();
    }

    public List<String> all() {
        return commentsBetween(1, slots.length);
    }
}
