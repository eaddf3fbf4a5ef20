package com.gdformatter.plugins.gdscript.format;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RegionSpacingCleanupTest {

    private final RegionSpacingCleanup cleanup = new RegionSpacingCleanup();

    private static List<String> texts(List<FormattedLine> lines) {
        return lines.stream().map(FormattedLine::getText).collect(Collectors.toList());
    }

    @Test
    void apply_removes_blank_lines_before_endregion() {
        List<FormattedLine> lines = List.of(
                FormattedLine.synthetic("", "#region a"),
                FormattedLine.of(2, "", "var x = 1"),
                FormattedLine.blank(),
                FormattedLine.blank(),
                FormattedLine.synthetic("", "#endregion"));

        List<String> out = texts(cleanup.apply(lines, Context.builder().build()));

        assertEquals(List.of("#region a", "var x = 1", "#endregion"), out);
    }

    @Test
    void apply_tops_up_blank_lines_before_a_following_region() {
        List<FormattedLine> lines = List.of(
                FormattedLine.synthetic("", "#endregion"),
                FormattedLine.blank(),
                FormattedLine.synthetic("", "#region b"));

        List<String> out = texts(cleanup.apply(lines, Context.builder().build()));

        assertEquals(List.of("#endregion", "", "", "#region b"), out);
    }

    @Test
    void apply_keeps_extra_blank_lines_between_regions() {
        List<FormattedLine> lines = List.of(
                FormattedLine.synthetic("", "#endregion"),
                FormattedLine.blank(),
                FormattedLine.blank(),
                FormattedLine.blank(),
                FormattedLine.synthetic("", "#region b"));

        List<String> out = texts(cleanup.apply(lines, Context.builder().build()));

        assertEquals(List.of("#endregion", "", "", "", "#region b"), out);
    }

    @Test
    void apply_leaves_blank_lines_before_other_code_untouched() {
        List<FormattedLine> lines = List.of(
                FormattedLine.synthetic("", "#endregion"),
                FormattedLine.blank(),
                FormattedLine.of(3, "", "var y = 2"));

        List<String> out = texts(cleanup.apply(lines, Context.builder().build()));

        assertEquals(List.of("#endregion", "", "var y = 2"), out);
    }
}
