package com.gdformatter.plugins.gdscript;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.gdformatter.api.FormatterResult;
import com.gdformatter.api.error.Severity;
import com.gdformatter.config.ConfigurationLoader;
import com.gdformatter.config.FormatterConfig;
import com.gdformatter.plugins.gdscript.checks.SafetyCheck;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GdScriptFormatterTest {

    private GdScriptFormatter plugin;

    @BeforeEach
    void setUp() {
        plugin = new GdScriptFormatter();
        plugin.initialize(ConfigurationLoader.loadDefaultConfig());
    }

    @AfterEach
    void tearDown() {
        plugin.close();
    }

    @Test
    void format_reports_changed_code() {
        FormatterResult result = plugin.format(Path.of("player.gd"), "var a=1\n");

        assertTrue(result.isSuccessful(), result.getErrors().toString());
        assertTrue(result.isChanged());
        assertEquals("var a = 1\n", result.getFormattedCode());
    }

    @Test
    void format_reports_unchanged_code() {
        FormatterResult result = plugin.format(Path.of("player.gd"), "var a = 1\n");

        assertTrue(result.isSuccessful());
        assertFalse(result.isChanged());
    }

    @Test
    void format_turns_syntax_error_into_fatal_result() {
        FormatterResult result = plugin.format(Path.of("broken.gd"), "func f(:\n\tpass\n");

        assertFalse(result.isSuccessful());
        assertNull(result.getFormattedCode());
        assertTrue(result.hasErrorsOfSeverity(Severity.FATAL));
        assertTrue(result.getErrors().get(0).getMessage().startsWith("Failed to parse GDScript"),
                result.getErrors().get(0).getMessage());
        assertEquals(1, result.getErrors().get(0).getLine());
    }

    @Test
    void format_parses_already_formatted_code_once() {
        FormatterResult result = plugin.format(Path.of("a.gd"), "func f():\n\tpass\n");

        assertTrue(result.isSuccessful(), result.getErrors().toString());
        assertEquals(1, plugin.cachedScriptCount());
    }

    @Test
    void format_reuses_the_parse_of_earlier_output_across_files() {
        FormatterResult first = plugin.format(Path.of("a.gd"), "var a=1\n");
        assertEquals(2, plugin.cachedScriptCount());

        FormatterResult second = plugin.format(Path.of("b.gd"), first.getFormattedCode());

        assertFalse(second.isChanged());
        assertEquals(2, plugin.cachedScriptCount());
    }

    @Test
    void close_releases_cached_parses() {
        plugin.format(Path.of("a.gd"), "var a=1\n");

        plugin.close();

        assertEquals(0, plugin.cachedScriptCount());
    }

    @Test
    void initialize_reads_indentation_and_line_length() {
        Map<String, Object> general = new HashMap<>();
        general.put("lineLength", 60);
        general.put("useTabs", false);
        general.put("indentSize", 2);
        plugin.initialize(ConfigurationLoader.loadDefaultConfig().withGeneralOverrides(general));

        assertEquals(60, plugin.getOptions().getMaxLineLength());
        assertEquals(2, plugin.getOptions().getSpacesForIndent());
        assertEquals("func f():\n  pass\n", plugin.format(Path.of("a.gd"), "func f():\n\tpass\n").getFormattedCode());
    }

    @Test
    void initialize_reads_blank_line_policies() {
        Map<String, Object> topLevel = new HashMap<>(Map.of("maxConsecutive", 1, "func", 1));
        Map<String, Object> gdscript = new HashMap<>(Map.of("blankLines", Map.of("topLevel", topLevel)));
        FormatterConfig config = new FormatterConfig(new HashMap<>(), Map.of("gdscript", gdscript));
        plugin.initialize(config);

        FormatterResult result = plugin.format(Path.of("a.gd"), "func a():\n\tpass\nfunc b():\n\tpass\n");

        assertEquals("func a():\n\tpass\n\nfunc b():\n\tpass\n", result.getFormattedCode());
    }

    @Test
    void initialize_can_disable_safety_checks() {
        Map<String, Object> gdscript = new HashMap<>(Map.of("safetyChecks", false));
        plugin.initialize(new FormatterConfig(new HashMap<>(), Map.of("gdscript", gdscript)));

        assertTrue(plugin.getChecks().isEmpty());
    }

    @Test
    void initialize_enables_all_safety_checks_by_default() {
        assertEquals(List.of("tree-equivalence", "comment-preservation", "idempotence"),
                plugin.getChecks().stream().map(SafetyCheck::getName).collect(Collectors.toList()));
    }
}
