package com.gdformatter.plugins.gdscript.comments;

import java.util.List;

import com.gdformatter.plugins.gdscript.parser.CommentToken;
import com.gdformatter.plugins.gdscript.parser.SourceLines;

/**
 * Builds the standalone and inline comment tables from the source and the
 * comments collected while tokenizing it.
 */
public final class CommentExtractor {

    private CommentExtractor() {
    }

    /**
     * Comments that are the only content of their line.
     */
    public static CommentTable standaloneComments(String source, List<CommentToken> comments) {
        return _gather(source, comments, true);
    }

    /**
     * Comments that trail code on their line.
     */
    public static CommentTable inlineComments(String source, List<CommentToken> comments) {
        return _gather(source, comments, false);
    }

    private static CommentTable _gather(String source, List<CommentToken> comments, boolean standalone) {
        int lineCount = SourceLines.count(source);
        String[] slots = new String[lineCount];
        for (CommentToken comment : comments) {
            if (comment.isStandalone() == standalone && comment.getLine() <= lineCount) {
                slots[comment.getLine() - 1] = comment.getText();
            }
        }
        return CommentTable.of(slots);
    }
}
