package com.gdformatter.plugins.gdscript.format;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import com.gdformatter.plugins.gdscript.comments.CommentExtractor;
import com.gdformatter.plugins.gdscript.parser.CommentToken;
import com.gdformatter.plugins.gdscript.parser.GdScriptParser;
import com.gdformatter.plugins.gdscript.parser.GdScriptSyntaxException;
import com.gdformatter.plugins.gdscript.parser.GdScriptTokenizer;
import com.gdformatter.plugins.gdscript.parser.SourceLines;
import com.gdformatter.plugins.gdscript.parser.Tree;
import com.gdformatter.util.LoggerUtil;

/**
 * Formats a whole GDScript document: walks the tree through the class
 * statement dispatcher, then reattaches inline and standalone comments and
 * tidies region spacing. The result always ends with a newline.
 */
public class GdScriptCodeFormatter {
    private static final Logger logger = LoggerUtil.getLogger(GdScriptCodeFormatter.class);

    private final GdScriptParser parser = new GdScriptParser();
    private final BlockFormatter blockFormatter = new BlockFormatter();
    private final StatementFormatter classStatementFormatter;
    private final List<PostProcessingPass> passes = List.of(
            new InlineCommentPass(),
            new StandaloneCommentPass(),
            new RegionSpacingCleanup());

    public GdScriptCodeFormatter() {
        ExpressionFormatter expressionFormatter = new ExpressionFormatter();
        StatementFormatter functionStatementFormatter =
                new FunctionStatementFormatter(blockFormatter, expressionFormatter);
        this.classStatementFormatter =
                new ClassStatementFormatter(blockFormatter, expressionFormatter, functionStatementFormatter);
    }

    public String formatCode(String source, FormattingOptions options) throws GdScriptSyntaxException {
        return formatCode(source, options, parser.parse(source), parser.parseComments(source));
    }

    /**
     * Formats with an already parsed tree and comment list, so callers that
     * parse anyway need not do it twice.
     */
    public String formatCode(String source, FormattingOptions options, Tree tree, List<CommentToken> comments) {
        Context context = createContext(source, options, comments);
        Outcome top = blockFormatter.formatBlock(tree.subtrees(), classStatementFormatter, context,
                options.getBlankLinePolicies().getTopLevel());

        List<FormattedLine> lines = new ArrayList<>(top.getLines());
        lines.add(FormattedLine.blank());
        for (PostProcessingPass pass : passes) {
            lines = pass.apply(lines, context);
        }
        logger.fine("Formatted " + context.getSourceLineCount() + " source lines into " + lines.size() + " lines");
        return lines.stream().map(FormattedLine::getText).collect(Collectors.joining("\n"));
    }

    /**
     * Root context of a format run: indentation level 0, cursor before line 1.
     */
    public static Context createContext(String source, FormattingOptions options, List<CommentToken> comments) {
        boolean tabs = options.usesTabs();
        return Context.builder()
                .singleIndentSize(tabs ? GdScriptTokenizer.TAB_WIDTH : options.getSpacesForIndent())
                .singleIndentString(tabs ? "\t" : " ".repeat(options.getSpacesForIndent()))
                .maxLineLength(options.getMaxLineLength())
                .indentLevel(0)
                .previouslyProcessedLineNumber(0)
                .sourceLines(SourceLines.splitOneBased(source))
                .standaloneComments(CommentExtractor.standaloneComments(source, comments))
                .inlineComments(CommentExtractor.inlineComments(source, comments))
                .blankLinePolicies(options.getBlankLinePolicies())
                .build();
    }
}
