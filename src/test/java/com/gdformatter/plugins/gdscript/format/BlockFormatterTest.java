package com.gdformatter.plugins.gdscript.format;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.gdformatter.plugins.gdscript.parser.GdScriptParser;
import com.gdformatter.plugins.gdscript.parser.Tree;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BlockFormatterTest {

    private final GdScriptParser parser = new GdScriptParser();
    private final BlockFormatter blockFormatter = new BlockFormatter();

    /**
     * Renders each statement as its kind and first line, so only the block
     * layout is under test.
     */
    private final StatementFormatter markerFormatter = (statement, context) -> new Outcome(
            List.of(FormattedLine.of(statement.getLine(), context.getIndentString(),
                    statement.getKind().name().toLowerCase() + "@" + statement.getLine())),
            statement.getEndLine());

    private List<String> formatTopLevel(String source) throws Exception {
        Context context = GdScriptCodeFormatter.createContext(source, FormattingOptions.defaults(),
                parser.parseComments(source));
        Tree file = parser.parse(source);
        Outcome outcome = blockFormatter.formatBlock(file.subtrees(), markerFormatter, context,
                BlankLinePolicies.defaults().getTopLevel());
        return outcome.getLines().stream().map(FormattedLine::getText).collect(Collectors.toList());
    }

    @Test
    void format_block_squeezes_blank_runs_to_the_maximum() throws Exception {
        List<String> out = formatTopLevel("var a = 1\n\n\n\n\nvar b = 2\n");

        assertEquals(List.of("class_var_stmt@1", "", "", "class_var_stmt@6"), out);
    }

    @Test
    void format_block_pads_around_functions() throws Exception {
        List<String> out = formatTopLevel("var a = 1\nfunc f():\n\tpass\nvar b = 2\n");

        assertEquals(List.of("class_var_stmt@1", "", "", "func_def@2", "", "", "class_var_stmt@4"), out);
    }

    @Test
    void format_block_keeps_leading_comments_next_to_the_function() throws Exception {
        List<String> out = formatTopLevel("var a = 1\n# about f\nfunc f():\n\tpass\n");

        assertEquals(List.of("class_var_stmt@1", "", "", "# about f", "func_def@3"), out);
    }

    @Test
    void format_block_drops_leading_and_trailing_blank_lines() throws Exception {
        List<String> out = formatTopLevel("\n\n# top\nvar a = 1\n\n# tail\n\n\n");

        assertEquals(List.of("# top", "class_var_stmt@4", "", "# tail"), out);
    }

    @Test
    void format_block_reports_last_owned_line_of_top_level() throws Exception {
        String source = "var a = 1\n# tail\n";
        Context context = GdScriptCodeFormatter.createContext(source, FormattingOptions.defaults(),
                parser.parseComments(source));

        Outcome outcome = blockFormatter.formatBlock(parser.parse(source).subtrees(), markerFormatter, context,
                BlankLinePolicies.defaults().getTopLevel());

        assertEquals(2, outcome.getLastProcessedLine());
    }

    @Test
    void format_block_leaves_dedented_trailing_comments_to_the_parent() throws Exception {
        String source = "func f():\n\tpass\n\t# inside\n# outside\n";
        Context context = GdScriptCodeFormatter.createContext(source, FormattingOptions.defaults(),
                parser.parseComments(source));
        Tree function = parser.parse(source).child(0);
        List<Tree> body = function.subtrees().subList(1, function.subtrees().size());

        Outcome outcome = blockFormatter.formatBlock(body, markerFormatter, context.createChildContext(1),
                BlankLinePolicies.defaults().getFunctionBody());

        assertEquals(List.of("\tpass_stmt@2", "\t# inside"),
                outcome.getLines().stream().map(FormattedLine::getText).collect(Collectors.toList()));
        assertEquals(3, outcome.getLastProcessedLine());
    }

    @Test
    void format_block_claims_every_source_line_exactly_once() throws Exception {
        String source = String.join("\n",
                "# header",
                "extends Node",
                "",
                "var items = [",
                "\t1,  # one",
                "\t# two",
                "\t2,",
                "]",
                "",
                "func f(x):",
                "\tif x:",
                "\t\tpass",
                "\t# end of f",
                "",
                "# about g",
                "func g():",
                "\treturn a.b(",
                "\t\t# inside",
                "\t\t1",
                "\t).c()",
                "# tail") + "\n";
        Context context = GdScriptCodeFormatter.createContext(source, FormattingOptions.defaults(),
                parser.parseComments(source));
        ExpressionFormatter expressionFormatter = new ExpressionFormatter();
        StatementFormatter classStatements = new ClassStatementFormatter(blockFormatter, expressionFormatter,
                new FunctionStatementFormatter(blockFormatter, expressionFormatter));
        List<int[]> claims = new ArrayList<>();
        StatementFormatter recording = (statement, statementContext) -> {
            Outcome outcome = classStatements.format(statement, statementContext);
            claims.add(new int[] {statement.getLine(), outcome.getLastProcessedLine()});
            return outcome;
        };

        Outcome outcome = blockFormatter.formatBlock(parser.parse(source).subtrees(), recording, context,
                BlankLinePolicies.defaults().getTopLevel());

        int previous = 0;
        for (int[] claim : claims) {
            assertTrue(claim[0] > previous, "statement at " + claim[0] + " overlaps line " + previous);
            assertTrue(claim[1] >= claim[0], "statement at " + claim[0] + " ends at " + claim[1]);
            for (int line = previous + 1; line < claim[0]; line++) {
                assertTrue(context.getSourceLine(line).isBlank() || context.getStandaloneComments().has(line),
                        "line " + line + " is not claimed");
            }
            previous = claim[1];
        }
        assertEquals(4, claims.size());
        assertEquals(13, claims.get(2)[1]);
        assertEquals(20, claims.get(3)[1]);
        assertEquals(context.getSourceLineCount(), outcome.getLastProcessedLine());

        int lastNumbered = 0;
        for (FormattedLine line : outcome.getLines()) {
            if (line.hasSourceLine()) {
                assertTrue(line.getSourceLine() >= lastNumbered, line.getText());
                lastNumbered = line.getSourceLine();
            }
        }
    }
}
