package com.gdformatter.plugins.gdscript.format;

import java.util.ArrayList;
import java.util.List;

import com.gdformatter.plugins.gdscript.comments.CommentTable;
import com.gdformatter.plugins.gdscript.parser.Tree;

/**
 * Renders a sequence of sibling statements.
 * <p>
 * The source between two statements is rebuilt from blank lines and
 * standalone comments: blank runs are squeezed to the policy maximum, and
 * the run after a statement and the run before the comments leading into
 * the next one are padded to what the policy requires around either kind.
 * Blank lines at the start and end of a block are dropped. Comments after
 * the last statement stay with the block while they are indented at least
 * as deep as its statements.
 */
public class BlockFormatter {

    public Outcome formatBlock(List<Tree> statements, StatementFormatter statementFormatter, Context context,
                               BlankLinePolicy policy) {
        List<FormattedLine> lines = new ArrayList<>();
        int previous = context.getPreviouslyProcessedLineNumber();
        Tree previousStatement = null;

        for (Tree statement : statements) {
            List<FormattedLine> gap = _reconstructGap(previous, statement.getLine(), context, policy);
            if (previousStatement == null) {
                _dropLeadingBlanks(gap);
            } else {
                _padAfterPrevious(gap, policy.requiredAround(previousStatement.getKind()));
                _padBeforeNext(gap, policy.requiredAround(statement.getKind()));
            }
            lines.addAll(gap);

            Outcome outcome = statementFormatter.format(statement, context);
            lines.addAll(outcome.getLines());
            previous = Math.max(previous, outcome.getLastProcessedLine());
            previousStatement = statement;
        }

        int lastOwned = _lastOwnedLine(statements, previous, context);
        List<FormattedLine> trailing = _reconstructGap(previous, lastOwned + 1, context, policy);
        if (previousStatement == null) {
            _dropLeadingBlanks(trailing);
        }
        while (!trailing.isEmpty() && trailing.get(trailing.size() - 1).isBlank()) {
            trailing.remove(trailing.size() - 1);
        }
        lines.addAll(trailing);
        return new Outcome(lines, lastOwned);
    }

    private static List<FormattedLine> _reconstructGap(int after, int before, Context context,
                                                       BlankLinePolicy policy) {
        List<FormattedLine> gap = new ArrayList<>();
        CommentTable standalone = context.getStandaloneComments();
        int end = Math.min(before, context.getSourceLineCount() + 1);
        int blanks = 0;
        for (int line = after + 1; line < end; line++) {
            String comment = standalone.get(line);
            if (comment != null) {
                gap.add(FormattedLine.synthetic(context.getIndentString(), comment));
                blanks = 0;
            } else if (context.getSourceLine(line).isBlank()) {
                blanks++;
                if (blanks <= policy.getMaxConsecutive()) {
                    gap.add(FormattedLine.blank());
                }
            }
        }
        return gap;
    }

    private static void _dropLeadingBlanks(List<FormattedLine> gap) {
        while (!gap.isEmpty() && gap.get(0).isBlank()) {
            gap.remove(0);
        }
    }

    private static void _padAfterPrevious(List<FormattedLine> gap, int required) {
        int existing = 0;
        while (existing < gap.size() && gap.get(existing).isBlank()) {
            existing++;
        }
        for (int i = existing; i < required; i++) {
            gap.add(0, FormattedLine.blank());
        }
    }

    /**
     * Pads the last blank run, the one separating the next statement and its
     * leading comments from whatever precedes them.
     */
    private static void _padBeforeNext(List<FormattedLine> gap, int required) {
        int insertAt = 0;
        for (int i = gap.size() - 1; i >= 0; i--) {
            if (gap.get(i).isBlank()) {
                insertAt = i + 1;
                break;
            }
        }
        int existing = 0;
        while (insertAt - existing - 1 >= 0 && gap.get(insertAt - existing - 1).isBlank()) {
            existing++;
        }
        for (int i = existing; i < required; i++) {
            gap.add(insertAt, FormattedLine.blank());
        }
    }

    private static int _lastOwnedLine(List<Tree> statements, int previous, Context context) {
        int lineCount = context.getSourceLineCount();
        if (context.getIndentLevel() == 0) {
            return Math.max(previous, lineCount);
        }
        int threshold;
        Tree first = statements.isEmpty() ? null : statements.get(0);
        if (first == null) {
            threshold = Integer.MAX_VALUE;
        } else if (first.getLine() == context.getPreviouslyProcessedLineNumber()) {
            threshold = context.sourceIndentWidth(first.getLine()) + 1;
        } else {
            threshold = context.sourceIndentWidth(first.getLine());
        }

        int last = previous;
        for (int line = previous + 1; line <= lineCount; line++) {
            if (context.getSourceLine(line).isBlank()) {
                continue;
            }
            if (context.getStandaloneComments().has(line) && context.sourceIndentWidth(line) >= threshold) {
                last = line;
                continue;
            }
            break;
        }
        return last;
    }
}
