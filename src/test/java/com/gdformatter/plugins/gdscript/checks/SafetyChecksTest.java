package com.gdformatter.plugins.gdscript.checks;

import java.util.ArrayList;
import java.util.List;

import com.gdformatter.api.error.Severity;
import com.gdformatter.plugins.gdscript.format.FormattingOptions;
import com.gdformatter.plugins.gdscript.format.GdScriptCodeFormatter;
import com.gdformatter.plugins.gdscript.parser.GdScriptParser;
import com.gdformatter.plugins.gdscript.parser.ParsedScript;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SafetyChecksTest {

    private static final String SOURCE = "var a = 1 # note\nfunc f():\n\treturn a\n";

    private final GdScriptParser parser = new GdScriptParser();
    private final GdScriptCodeFormatter formatter = new GdScriptCodeFormatter();

    private FormattingRun run(String formattedCode) throws Exception {
        return new FormattingRun(ParsedScript.parse(parser, SOURCE), formattedCode, FormattingOptions.defaults(),
                source -> ParsedScript.parse(parser, source));
    }

    @Test
    void all_checks_pass_on_real_formatter_output() throws Exception {
        FormattingRun run = run(formatter.formatCode(SOURCE, FormattingOptions.defaults()));

        assertTrue(new TreeEquivalenceCheck().check(run).isPassed());
        assertTrue(new CommentPreservationCheck().check(run).isPassed());
        assertTrue(new IdempotenceCheck(formatter).check(run).isPassed());
    }

    @Test
    void checks_share_one_parse_of_the_formatted_code() throws Exception {
        List<String> parsed = new ArrayList<>();
        FormattingRun run = new FormattingRun(ParsedScript.parse(parser, SOURCE),
                formatter.formatCode(SOURCE, FormattingOptions.defaults()), FormattingOptions.defaults(),
                source -> {
                    parsed.add(source);
                    return ParsedScript.parse(parser, source);
                });

        assertTrue(new TreeEquivalenceCheck().check(run).isPassed());
        assertTrue(new CommentPreservationCheck().check(run).isPassed());
        assertTrue(new IdempotenceCheck(formatter).check(run).isPassed());
        assertEquals(List.of(run.getFormattedCode()), parsed);
    }

    @Test
    void tree_equivalence_fails_when_code_changes_meaning() throws Exception {
        CheckResult result = new TreeEquivalenceCheck()
                .check(run("var a = 2  # note\n\n\nfunc f():\n\treturn a\n"));

        assertFalse(result.isPassed());
        assertEquals(Severity.ERROR, result.getErrors().get(0).getSeverity());
    }

    @Test
    void tree_equivalence_fails_when_output_does_not_parse() throws Exception {
        CheckResult result = new TreeEquivalenceCheck().check(run("var a = (\n"));

        assertFalse(result.isPassed());
        assertTrue(result.getErrors().get(0).getMessage().contains("does not parse"),
                result.getErrors().get(0).getMessage());
    }

    @Test
    void comment_preservation_reports_the_lost_comment() throws Exception {
        CheckResult result = new CommentPreservationCheck()
                .check(run("var a = 1\n\n\nfunc f():\n\treturn a\n"));

        assertFalse(result.isPassed());
        assertTrue(result.getErrors().get(0).getMessage().contains("# note"), result.getErrors().get(0).getMessage());
        assertEquals(1, result.getErrors().get(0).getLine());
    }

    @Test
    void comment_preservation_reports_duplicated_comments() throws Exception {
        CheckResult result = new CommentPreservationCheck()
                .check(run("var a = 1  # note\n# note\n\nfunc f():\n\treturn a\n"));

        assertFalse(result.isPassed());
    }

    @Test
    void idempotence_reports_first_unstable_line() throws Exception {
        CheckResult result = new IdempotenceCheck(formatter)
                .check(run("var a = 1  # note\nfunc f():\n\treturn a\n"));

        assertFalse(result.isPassed());
        assertEquals(2, result.getErrors().get(0).getLine());
        assertNotNull(result.getErrors().get(0).getSuggestion());
    }
}
