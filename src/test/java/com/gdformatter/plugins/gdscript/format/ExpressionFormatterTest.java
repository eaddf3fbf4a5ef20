package com.gdformatter.plugins.gdscript.format;

import java.util.List;
import java.util.stream.Collectors;

import com.gdformatter.plugins.gdscript.parser.GdScriptParser;
import com.gdformatter.plugins.gdscript.parser.Tree;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionFormatterTest {

    private final GdScriptParser parser = new GdScriptParser();
    private final ExpressionFormatter expressionFormatter = new ExpressionFormatter();

    /**
     * Formats the value of the single declaration in {@code source}.
     */
    private List<FormattedLine> formatValue(String source, String prefix, int lineLength, int level)
            throws Exception {
        Context context = GdScriptCodeFormatter.createContext(source, FormattingOptions.withLineLength(lineLength),
                parser.parseComments(source));
        for (int i = 0; i < level; i++) {
            context = context.createChildContext(0);
        }
        Tree statement = parser.parse(source).child(0);
        ExpressionContext expressionContext =
                new ExpressionContext(prefix, statement.getLine(), "", statement.getEndLine());
        return expressionFormatter.formatExpression(statement.last(), expressionContext, context).getLines();
    }

    private List<String> format(String source, String prefix, int lineLength) throws Exception {
        return formatValue(source, prefix, lineLength, 0).stream()
                .map(FormattedLine::getText)
                .collect(Collectors.toList());
    }

    @Test
    void format_keeps_short_expression_on_one_line() throws Exception {
        List<String> out = format("var x = [ 1,2 ]\n", "var x = ", 100);

        assertEquals(List.of("var x = [1, 2]"), out);
    }

    @Test
    void format_explodes_long_array_with_trailing_comma() throws Exception {
        List<String> out = format("var x = [alpha_value, beta_value, gamma_value, delta_value]\n", "var x = ", 40);

        assertEquals(List.of(
                "var x = [",
                "\talpha_value,",
                "\tbeta_value,",
                "\tgamma_value,",
                "\tdelta_value,",
                "]"), out);
    }

    @Test
    void format_explodes_long_call_without_trailing_comma() throws Exception {
        List<String> out = format("var x = some_function(first_argument, second_argument)\n", "var x = ", 40);

        assertEquals(List.of(
                "var x = some_function(",
                "\tfirst_argument,",
                "\tsecond_argument",
                ")"), out);
    }

    @Test
    void format_wraps_operator_chain_in_parentheses() throws Exception {
        List<String> out = format("var total = first_value + second_value + third_value\n", "var total = ", 40);

        assertEquals(List.of(
                "var total = (",
                "\tfirst_value",
                "\t+ second_value",
                "\t+ third_value",
                ")"), out);
    }

    @Test
    void format_splits_only_the_outermost_precedence_level() throws Exception {
        List<String> out = format("var total = first_value * factor + second_value * factor\n",
                "var total = ", 40);

        assertEquals(List.of(
                "var total = (",
                "\tfirst_value * factor",
                "\t+ second_value * factor",
                ")"), out);
    }

    @Test
    void format_explodes_nested_containers_only_where_needed() throws Exception {
        List<String> out = format("var d = {name = \"player\", stats = [strength, agility, intelligence]}\n",
                "var d = ", 40);

        assertEquals(List.of(
                "var d = {",
                "\tname = \"player\",",
                "\tstats = [",
                "\t\tstrength,",
                "\t\tagility,",
                "\t\tintelligence,",
                "\t],",
                "}"), out);
    }

    @Test
    void format_breaks_short_expression_when_a_comment_is_inside() throws Exception {
        List<FormattedLine> out = formatValue("var x = [\n\t1,  # one\n\t2,\n]\n", "var x = ", 100, 0);

        assertEquals(List.of("var x = [", "\t1,", "\t2,", "]"),
                out.stream().map(FormattedLine::getText).collect(Collectors.toList()));
        assertEquals(List.of(1, 2, 3, 4),
                out.stream().map(FormattedLine::getSourceLine).collect(Collectors.toList()));
    }

    @Test
    void format_leaves_unsplittable_expression_long() throws Exception {
        List<String> out = format("var x = some_really_long_identifier_that_cannot_be_split_anywhere\n",
                "var x = ", 40);

        assertEquals(List.of("var x = some_really_long_identifier_that_cannot_be_split_anywhere"), out);
    }

    @Test
    void format_counts_indentation_against_the_line_length() throws Exception {
        List<String> out = formatValue("var x = [aaa, bbb]\n", "var x = ", 20, 1).stream()
                .map(FormattedLine::getText)
                .collect(Collectors.toList());

        assertEquals(List.of("\tvar x = [", "\t\taaa,", "\t\tbbb,", "\t]"), out);
    }
}
