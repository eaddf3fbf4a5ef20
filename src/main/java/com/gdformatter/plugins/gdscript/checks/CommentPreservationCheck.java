package com.gdformatter.plugins.gdscript.checks;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.gdformatter.plugins.gdscript.parser.CommentToken;
import com.gdformatter.plugins.gdscript.parser.GdScriptSyntaxException;

/**
 * Every comment of the input must appear in the output as often as it did before.
 */
public class CommentPreservationCheck implements SafetyCheck {

    @Override
    public String getName() {
        return "comment-preservation";
    }

    @Override
    public CheckResult check(FormattingRun run) {
        List<CommentToken> formattedComments;
        try {
            formattedComments = run.getFormattedScript().getComments();
        } catch (GdScriptSyntaxException e) {
            return CheckResult.failed("Formatted code does not parse: " + e.getMessage(), e.getLine(),
                    "Report this input as a formatter bug");
        }
        Map<String, Integer> expected = _count(run.getOriginalComments());
        Map<String, Integer> actual = _count(formattedComments);
        if (expected.equals(actual)) {
            return CheckResult.passed();
        }
        for (CommentToken comment : run.getOriginalComments()) {
            if (actual.getOrDefault(comment.getText(), 0) < expected.get(comment.getText())) {
                return CheckResult.failed("Comment lost during formatting: " + comment.getText(),
                        comment.getLine(), "Report this input as a formatter bug");
            }
        }
        return CheckResult.failed("Formatting introduced comments that were not in the input", 1,
                "Report this input as a formatter bug");
    }

    private static Map<String, Integer> _count(List<CommentToken> comments) {
        Map<String, Integer> counts = new HashMap<>();
        for (CommentToken comment : comments) {
            counts.merge(comment.getText(), 1, Integer::sum);
        }
        return counts;
    }
}
