package com.gdformatter.plugins.gdscript.format;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.gdformatter.plugins.gdscript.comments.CommentTable;

/**
 * Appends trailing comments to the rendered line that owns them. Walking
 * backwards, each numbered line takes every inline comment from its own
 * source line up to the lines already taken by later output.
 */
public class InlineCommentPass implements PostProcessingPass {
    public static final int INLINE_COMMENT_OFFSET = 2;

    private static final String OFFSET = " ".repeat(INLINE_COMMENT_OFFSET);

    @Override
    public List<FormattedLine> apply(List<FormattedLine> lines, Context context) {
        CommentTable comments = context.getInlineComments();
        int cursor = comments.lineCount() + 1;
        List<FormattedLine> result = new ArrayList<>(lines.size());

        for (int i = lines.size() - 1; i >= 0; i--) {
            FormattedLine line = lines.get(i);
            if (!line.hasSourceLine()) {
                result.add(line);
                continue;
            }
            int lineNumber = line.getSourceLine();
            List<String> claimed = comments.commentsBetween(lineNumber, cursor);
            cursor = Math.min(cursor, lineNumber);
            if (claimed.isEmpty()) {
                result.add(line);
            } else {
                result.add(line.withBody(line.getBody() + OFFSET + String.join(OFFSET, claimed)));
            }
        }
        Collections.reverse(result);
        return result;
    }
}
