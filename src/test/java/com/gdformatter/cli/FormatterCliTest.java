package com.gdformatter.cli;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.gdformatter.config.ConfigurationLoader;
import com.gdformatter.config.FormatterConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class FormatterCliTest {

    @TempDir
    Path workDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        FormatterCli cli = new FormatterCli(
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                workDir);
        return cli.run(args);
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void format_stdin_prints_formatted_code() {
        int code = run("var a=1\n", "format", "-");

        assertEquals(0, code, err());
        assertEquals("var a = 1\n", out());
    }

    @Test
    void check_stdin_fails_when_input_would_change() {
        assertEquals(1, run("var a=1\n", "check", "-", "--no-color"));
        assertTrue(err().contains("stdin needs formatting"), err());
    }

    @Test
    void check_stdin_passes_for_formatted_input() {
        assertEquals(0, run("var a = 1\n", "check", "-"));
    }

    @Test
    void format_stdin_reports_syntax_error() {
        int code = run("func f(:\n", "format", "-", "--no-color");

        assertEquals(1, code);
        assertTrue(err().contains("FATAL: Failed to parse GDScript"), err());
        assertEquals("", out());
    }

    @Test
    void check_directory_reports_without_writing_then_format_rewrites() throws Exception {
        Path script = workDir.resolve("player.gd");
        Files.writeString(script, "var a=1\n");

        assertEquals(1, run("", "check", ".", "--no-color"));
        assertEquals("var a=1\n", Files.readString(script));
        assertTrue(err().contains("File needs formatting"), err());

        assertEquals(0, run("", "format", ".", "--no-color"));
        assertEquals("var a = 1\n", Files.readString(script));

        assertEquals(0, run("", "check", ".", "--no-color"));
    }

    @Test
    void check_in_ci_mode_prints_a_result_line() throws Exception {
        Files.writeString(workDir.resolve("a.gd"), "var a=1\n");
        Files.writeString(workDir.resolve("b.gd"), "var b = 1\n");

        run("", "check", ".", "--ci", "--no-color");

        assertTrue(out().contains("RESULT:files=2;changed=1;unchanged=1;errors=0"), out());
    }

    @Test
    void check_fails_on_file_with_syntax_error() throws Exception {
        Files.writeString(workDir.resolve("broken.gd"), "func f(:\n");

        assertEquals(1, run("", "check", ".", "--no-color"));
        assertTrue(err().contains("Cannot check"), err());
        assertTrue(out().contains("Files with errors: 1"), out());
    }

    @Test
    void format_applies_command_line_overrides() throws Exception {
        Path script = workDir.resolve("indent.gd");
        Files.writeString(script, "func f():\n\tpass\n");

        assertEquals(0, run("", "format", "indent.gd", "--use-spaces=4", "--no-color"));

        assertEquals("func f():\n    pass\n", Files.readString(script));
    }

    @Test
    void format_reads_config_file_from_working_directory() throws Exception {
        Files.writeString(workDir.resolve(ConfigurationLoader.DEFAULT_CONFIG_FILE),
                "general:\n  useTabs: false\n  indentSize: 2\n");
        Path script = workDir.resolve("a.gd");
        Files.writeString(script, "func f():\n\tpass\n");

        assertEquals(0, run("", "format", ".", "--no-color"));

        assertEquals("func f():\n  pass\n", Files.readString(script));
    }

    @Test
    void format_only_includes_matching_files() throws Exception {
        Path kept = workDir.resolve("keep_me.gd");
        Path skipped = workDir.resolve("other.gd");
        Files.writeString(kept, "var a=1\n");
        Files.writeString(skipped, "var a=1\n");

        assertEquals(0, run("", "format", ".", "--include=keep_*", "--no-color"));

        assertEquals("var a = 1\n", Files.readString(kept));
        assertEquals("var a=1\n", Files.readString(skipped));
    }

    @Test
    void format_fails_for_missing_path() {
        assertEquals(1, run("", "format", "nowhere", "--no-color"));
        assertTrue(err().contains("Path does not exist"), err());
    }

    @Test
    void init_writes_default_config_once() throws Exception {
        Path config = workDir.resolve(ConfigurationLoader.DEFAULT_CONFIG_FILE);

        assertEquals(0, run("", "init", "--no-color"));
        assertEquals(ConfigurationLoader.defaultConfigText(), Files.readString(config));

        assertEquals(1, run("", "init", "--no-color"));
        assertEquals(0, run("", "init", "--force", "--no-color"));
    }

    @Test
    void init_saves_command_line_overrides() throws Exception {
        assertEquals(0, run("", "init", "--line-length=80"));

        FormatterConfig config = ConfigurationLoader.loadConfig(workDir.resolve(ConfigurationLoader.DEFAULT_CONFIG_FILE));
        int lineLength = config.getGeneralConfig("lineLength", 0);
        assertEquals(80, lineLength);
    }

    @Test
    void version_and_help_succeed() {
        assertEquals(0, run("", "--version"));
        assertTrue(out().contains("GDScript Formatter version"), out());
        assertEquals(0, run("", "-h", "--no-color"));
        assertTrue(out().contains("Usage:"), out());
    }

    @Test
    void unknown_command_and_missing_arguments_fail() {
        assertEquals(1, run("", "reformat", "--no-color"));
        assertTrue(err().contains("Unknown command: reformat"), err());
        assertEquals(1, run(""));
        assertEquals(1, run("", "format"));
    }

    @Test
    void include_pattern_matching() {
        assertTrue(FormatterCli._matchesIncludePattern(Path.of("a/player.gd"), "*.gd"));
        assertTrue(FormatterCli._matchesIncludePattern(Path.of("a/player.gd"), "play*"));
        assertTrue(FormatterCli._matchesIncludePattern(Path.of("a/player.gd"), "layer"));
        assertFalse(FormatterCli._matchesIncludePattern(Path.of("a/enemy.gd"), "play*"));
        assertTrue(FormatterCli._matchesIncludePattern(Path.of("a/enemy.gd"), null));
    }
}
