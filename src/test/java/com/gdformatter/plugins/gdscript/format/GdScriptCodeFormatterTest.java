package com.gdformatter.plugins.gdscript.format;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.gdformatter.plugins.gdscript.parser.CommentToken;
import com.gdformatter.plugins.gdscript.parser.GdScriptParser;
import com.gdformatter.plugins.gdscript.parser.GdScriptSyntaxException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import static org.junit.jupiter.api.Assertions.*;

class GdScriptCodeFormatterTest {

    private final GdScriptCodeFormatter formatter = new GdScriptCodeFormatter();

    private static String gd(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    private String format(String source) throws GdScriptSyntaxException {
        return formatter.formatCode(source, FormattingOptions.defaults());
    }

    private static List<String> commentTexts(String source) throws GdScriptSyntaxException {
        return new GdScriptParser().parseComments(source).stream()
                .map(CommentToken::getText)
                .sorted()
                .collect(Collectors.toList());
    }

    static Stream<String> commentedSources() {
        return Stream.of(
                gd("# header", "extends Node", "", "", "# doc", "var x = 1 # inline"),
                gd("var a = [", "\t1, # one", "\t# two", "\t2,", "]"),
                gd("func f():", "\tvar x = a.b(", "\t\t# keep me", "\t\t1", "\t).c()"),
                gd("func f():", "\tvar x = foo(a,", "\t\t# keep me", "\t\tb)[0]"),
                gd("func f():", "\tvar x = foo(", "\t\t# nothing yet", "\t)"),
                gd("signal died(", "\t# no parameters", ")"),
                gd("func f(x):", "\tif x:", "\t\tpass", "\t# before else", "\telse:", "\t\tpass"),
                gd("#region A", "var a = 1", "", "#endregion", "#region B", "var b = 2", "#endregion"),
                gd("class A:", "\tvar x = 1", "\t# end of A", "", "var y = 2"));
    }

    @Test
    void format_normalizes_declaration_spacing() throws Exception {
        String out = format(gd("const A=1", "const B:int=2", "const C:=3", "var d:Array[int]"));

        assertEquals(gd("const A = 1", "const B: int = 2", "const C := 3", "var d: Array[int]"), out);
    }

    @Test
    void format_renders_signals_and_enums() throws Exception {
        String out = format(gd("signal died", "signal hit(a,b)", "enum {A,B}", "enum Named{X=1,Y}"));

        assertEquals(gd("signal died", "signal hit(a, b)", "enum {A, B}", "enum Named {X = 1, Y}"), out);
    }

    @Test
    void format_drops_the_empty_parameter_list_of_a_signal() throws Exception {
        String out = format(gd("signal died()", "signal hit(cause)"));

        assertEquals(gd("signal died", "signal hit(cause)"), out);
    }

    @Test
    void format_keeps_comment_inside_the_callee_of_a_chained_call() throws Exception {
        String out = format(gd("func f():", "\tvar x = a.b(", "\t\t# keep me", "\t\t1", "\t).c()"));

        assertEquals(gd("func f():", "\tvar x = a.b(", "\t\t# keep me", "\t\t1", "\t).c()"), out);
    }

    @Test
    void format_breaks_the_call_not_the_subscript_holding_a_comment() throws Exception {
        String out = format(gd("func f():", "\tvar x = foo(a,", "\t\t# keep me", "\t\tb)[0]"));

        assertEquals(gd("func f():", "\tvar x = foo(", "\t\ta,", "\t\t# keep me", "\t\tb", "\t)[0]"), out);
    }

    @ParameterizedTest
    @MethodSource("commentedSources")
    void format_preserves_comments_and_is_idempotent(String source) throws Exception {
        String once = format(source);

        assertEquals(commentTexts(source), commentTexts(once), once);
        assertEquals(once, format(once));
    }

    @Test
    void format_separates_top_level_functions_with_two_blank_lines() throws Exception {
        String out = format(gd("func a():", "\tpass", "func b():", "\tpass"));

        assertEquals(gd("func a():", "\tpass", "", "", "func b():", "\tpass"), out);
    }

    @Test
    void format_indents_nested_classes_and_pads_class_members() throws Exception {
        String out = format(gd(
                "class A:",
                "    class B:",
                "        var x=1",
                "    func f():",
                "        pass"));

        assertEquals(gd(
                "class A:",
                "\tclass B:",
                "\t\tvar x = 1",
                "",
                "\tfunc f():",
                "\t\tpass"), out);
    }

    @Test
    void format_adds_static_keyword_and_return_type() throws Exception {
        String out = format(gd("static func make()->int:", "\treturn 1"));

        assertEquals(gd("static func make() -> int:", "\treturn 1"), out);
    }

    @Test
    void format_moves_inline_bodies_onto_their_own_lines() throws Exception {
        String out = format(gd(
                "func f(x):",
                "\tif x>1: return 1",
                "\telif x<0:",
                "\t\treturn -1",
                "\telse:",
                "\t\treturn 0"));

        assertEquals(gd(
                "func f(x):",
                "\tif x > 1:",
                "\t\treturn 1",
                "\telif x < 0:",
                "\t\treturn -1",
                "\telse:",
                "\t\treturn 0"), out);
    }

    @Test
    void format_renders_match_and_for_statements() throws Exception {
        String out = format(gd(
                "func f(x, items):",
                "\tmatch x:",
                "\t\t1,2:",
                "\t\t\tpass",
                "\t\t_:",
                "\t\t\tpass",
                "\tfor i:int in items:",
                "\t\tprint(i)"));

        assertEquals(gd(
                "func f(x, items):",
                "\tmatch x:",
                "\t\t1, 2:",
                "\t\t\tpass",
                "\t\t_:",
                "\t\t\tpass",
                "\tfor i: int in items:",
                "\t\tprint(i)"), out);
    }

    @Test
    void format_normalizes_assignments_and_await() throws Exception {
        String out = format(gd(
                "func f():",
                "\tx+=1",
                "\tvar d={\"a\":1}",
                "\tawait get_tree().process_frame"));

        assertEquals(gd(
                "func f():",
                "\tx += 1",
                "\tvar d = {\"a\": 1}",
                "\tawait get_tree().process_frame"), out);
    }

    @Test
    void format_keeps_standalone_and_inline_comments() throws Exception {
        String out = format(gd("# header", "extends Node", "", "", "# doc", "var x = 1 # inline"));

        assertEquals(gd("# header", "extends Node", "", "", "# doc", "var x = 1  # inline"), out);
    }

    @Test
    void format_keeps_comments_inside_multiline_array() throws Exception {
        String source = gd("var a = [", "\t1,", "\t# two", "\t2,", "]");

        assertEquals(source, format(source));
    }

    @Test
    void format_keeps_indented_trailing_comment_inside_class() throws Exception {
        String out = format(gd("class A:", "\tvar x = 1", "\t# end of A", "", "var y = 2"));

        assertEquals(gd("class A:", "\tvar x = 1", "\t# end of A", "", "", "var y = 2"), out);
    }

    @Test
    void format_attaches_comment_before_else_to_the_previous_branch() throws Exception {
        String out = format(gd(
                "func f(x):",
                "\tif x:",
                "\t\tpass",
                "\t# before else",
                "\telse:",
                "\t\tpass"));

        assertEquals(gd(
                "func f(x):",
                "\tif x:",
                "\t\tpass",
                "\t\t# before else",
                "\telse:",
                "\t\tpass"), out);
    }

    @Test
    void format_separates_adjacent_regions() throws Exception {
        String out = format(gd(
                "#region A",
                "var a = 1",
                "",
                "#endregion",
                "#region B",
                "var b = 2",
                "#endregion"));

        assertEquals(gd(
                "#region A",
                "var a = 1",
                "#endregion",
                "",
                "",
                "#region B",
                "var b = 2",
                "#endregion"), out);
    }

    @Test
    void format_indents_with_spaces_when_configured() throws Exception {
        FormattingOptions options = new FormattingOptions(100, 2, BlankLinePolicies.defaults());

        String out = formatter.formatCode(gd("func f():", "\tif true:", "\t\tpass"), options);

        assertEquals(gd("func f():", "  if true:", "    pass"), out);
    }

    @Test
    void format_normalizes_line_endings_and_adds_final_newline() throws Exception {
        String out = format("var a = 1\r\nvar b = 2");

        assertEquals(gd("var a = 1", "var b = 2"), out);
    }

    @Test
    void format_returns_empty_output_for_empty_input() throws Exception {
        assertEquals("", format(""));
    }

    @Test
    void format_is_stable_on_its_own_output() throws Exception {
        String source = gd(
                "extends Node2D",
                "# settings",
                "const SPEEDS={slow=1,fast=[first_speed_value,second_speed_value,third_speed_value,fourth_speed_value]}",
                "var health:int=100 # hp",
                "signal damaged(amount,source_node,was_critical_hit,damage_type_name,extra_payload)",
                "func take(amount):",
                "\tif amount>health and not is_invulnerable and current_state!=State.DEAD and can_receive_damage_now:",
                "\t\thealth-=amount",
                "\t\t# died",
                "\t\temit_signal(\"damaged\",amount)",
                "\treturn health",
                "class Inner:",
                "\tvar v=[",
                "\t\t1, # one",
                "\t\t2",
                "\t]");

        String once = format(source);
        String twice = format(once);

        assertEquals(once, twice);
        assertTrue(once.contains("\n# settings\nconst SPEEDS = {\n"), once);
        assertTrue(once.contains("var health: int = 100  # hp"), once);
        assertTrue(once.contains("\t\t# died\n"), once);
        assertTrue(once.contains("\tif (\n\t\tamount > health\n\t\tand not is_invulnerable\n"), once);
        assertTrue(once.contains("\t\t1,  # one\n"), once);
        assertTrue(once.endsWith("\n"), once);
    }

    @Test
    void format_rejects_invalid_source() {
        assertThrows(GdScriptSyntaxException.class, () -> format("func f(:\n\tpass\n"));
    }
}
