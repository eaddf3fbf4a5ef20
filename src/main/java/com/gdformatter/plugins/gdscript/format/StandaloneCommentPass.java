package com.gdformatter.plugins.gdscript.format;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.gdformatter.plugins.gdscript.comments.CommentTable;

/**
 * Reinserts standalone comments that fell inside a multi-line construct and
 * were not emitted by the block formatter.
 * <p>
 * Walking backwards, a synthetic line ends the current run of numbered
 * lines. The first numbered line seen after that is the anchor of the run;
 * each earlier numbered line of the run claims the comments from its own
 * source line up to the anchor and gets them inserted right after it,
 * indented like the deeper of itself and the line that follows.
 * <p>
 * Region markers get spacing inside a claimed group: a blank line before
 * {@code #region}, no blank lines before {@code #endregion}, and two blank
 * lines between an {@code #endregion} and a directly following {@code #region}.
 */
public class StandaloneCommentPass implements PostProcessingPass {

    @Override
    public List<FormattedLine> apply(List<FormattedLine> lines, Context context) {
        CommentTable comments = context.getStandaloneComments();
        int cursor = comments.lineCount() + 1;
        boolean insideRun = false;
        int anchor = 0;
        List<FormattedLine> result = new ArrayList<>(lines.size());

        for (int i = lines.size() - 1; i >= 0; i--) {
            FormattedLine line = lines.get(i);
            if (!line.hasSourceLine()) {
                result.add(line);
                insideRun = false;
                continue;
            }
            int lineNumber = line.getSourceLine();
            if (!insideRun) {
                result.add(line);
                insideRun = true;
                anchor = lineNumber;
                continue;
            }
            List<String> claimed = comments.commentsBetween(lineNumber, Math.min(cursor, anchor));
            cursor = Math.min(cursor, lineNumber);
            if (!claimed.isEmpty()) {
                FormattedLine following = result.get(result.size() - 1);
                String indent = _greaterIndent(line, following);
                List<FormattedLine> group = _group(claimed, indent);
                for (int g = group.size() - 1; g >= 0; g--) {
                    result.add(group.get(g));
                }
            }
            result.add(line);
        }
        Collections.reverse(result);
        return result;
    }

    private static List<FormattedLine> _group(List<String> comments, String indent) {
        List<FormattedLine> group = new ArrayList<>();
        for (int i = 0; i < comments.size(); i++) {
            String comment = comments.get(i);
            if (RegionMarkers.opensRegion(comment)) {
                if (group.isEmpty() || !group.get(group.size() - 1).isBlank()) {
                    group.add(FormattedLine.blank());
                }
                group.add(FormattedLine.synthetic(indent, comment));
            } else if (RegionMarkers.closesRegion(comment)) {
                while (!group.isEmpty() && group.get(group.size() - 1).isBlank()) {
                    group.remove(group.size() - 1);
                }
                group.add(FormattedLine.synthetic(indent, comment));
                if (i + 1 < comments.size() && RegionMarkers.opensRegion(comments.get(i + 1))) {
                    group.add(FormattedLine.blank());
                    group.add(FormattedLine.blank());
                }
            } else {
                group.add(FormattedLine.synthetic(indent, comment));
            }
        }
        return group;
    }

    private static String _greaterIndent(FormattedLine a, FormattedLine b) {
        String first = _leadingWhitespace(a.getText());
        String second = _leadingWhitespace(b.getText());
        return first.length() > second.length() ? first : second;
    }

    private static String _leadingWhitespace(String text) {
        int end = 0;
        while (end < text.length() && Character.isWhitespace(text.charAt(end))) {
            end++;
        }
        return text.substring(0, end);
    }
}
