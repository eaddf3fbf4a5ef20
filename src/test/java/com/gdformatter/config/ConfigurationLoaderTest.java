package com.gdformatter.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_default_config_reads_bundled_settings() {
        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();
        int lineLength = config.getGeneralConfig("lineLength", 0);
        boolean useTabs = config.getGeneralConfig("useTabs", Boolean.FALSE);
        List<?> ignoreFiles = config.getGeneralConfig("ignoreFiles", List.of());
        boolean safetyChecks = config.getPluginConfig("gdscript", "safetyChecks", Boolean.FALSE);

        assertEquals(100, lineLength);
        assertTrue(useTabs);
        assertEquals(List.of(".godot/*"), ignoreFiles);
        assertTrue(safetyChecks);
    }

    @Test
    void load_config_without_path_falls_back_to_defaults() {
        assertSame(ConfigurationLoader.loadDefaultConfig(), ConfigurationLoader.loadConfig(null));
        assertSame(ConfigurationLoader.loadDefaultConfig(), ConfigurationLoader.loadConfig(tempDir.resolve("missing.yml")));
    }

    @Test
    void load_config_reads_user_file_and_fills_missing_values() throws Exception {
        Path file = tempDir.resolve(ConfigurationLoader.DEFAULT_CONFIG_FILE);
        Files.writeString(file, "general:\n  lineLength: 80\n");

        FormatterConfig config = ConfigurationLoader.loadConfig(file);
        int lineLength = config.getGeneralConfig("lineLength", 0);
        int indentSize = config.getGeneralConfig("indentSize", 0);
        boolean useTabs = config.getGeneralConfig("useTabs", Boolean.FALSE);
        boolean safetyChecks = config.getPluginConfig("gdscript", "safetyChecks", Boolean.FALSE);

        assertEquals(80, lineLength);
        assertEquals(4, indentSize);
        assertTrue(useTabs);
        assertTrue(safetyChecks);
    }

    @Test
    void load_config_replaces_out_of_range_values_with_defaults() throws Exception {
        Path file = tempDir.resolve("ranges.yml");
        Files.writeString(file, "general:\n  lineLength: 5\n  indentSize: \"wide\"\n");

        FormatterConfig config = ConfigurationLoader.loadConfig(file);
        int lineLength = config.getGeneralConfig("lineLength", 0);
        int indentSize = config.getGeneralConfig("indentSize", 0);

        assertEquals(100, lineLength);
        assertEquals(4, indentSize);
    }

    @Test
    @SuppressWarnings("unchecked")
    void load_config_drops_invalid_blank_line_counts() throws Exception {
        Path file = tempDir.resolve("blank.yml");
        Files.writeString(file, String.join("\n",
                "plugins:",
                "  gdscript:",
                "    blankLines:",
                "      topLevel:",
                "        maxConsecutive: 9",
                "        func: 1",
                ""));

        FormatterConfig config = ConfigurationLoader.loadConfig(file);
        Map<String, Object> blankLines =
                (Map<String, Object>) config.getPluginConfigsMap().get("gdscript").get("blankLines");
        Map<String, Object> topLevel = (Map<String, Object>) blankLines.get("topLevel");

        assertFalse(topLevel.containsKey("maxConsecutive"));
        assertEquals(1, topLevel.get("func"));
    }

    @Test
    void load_config_falls_back_to_defaults_on_malformed_yaml() throws Exception {
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "general: [unclosed\n");

        assertSame(ConfigurationLoader.loadDefaultConfig(), ConfigurationLoader.loadConfig(file));
    }

    @Test
    void save_config_round_trips_through_load() throws Exception {
        Path file = tempDir.resolve("nested/dir/" + ConfigurationLoader.DEFAULT_CONFIG_FILE);
        FormatterConfig config = ConfigurationLoader.loadDefaultConfig()
                .withGeneralOverrides(Map.of("lineLength", 120, "useTabs", false));

        ConfigurationLoader.saveConfig(config, file);
        FormatterConfig loaded = ConfigurationLoader.loadConfig(file);
        int lineLength = loaded.getGeneralConfig("lineLength", 0);
        boolean useTabs = loaded.getGeneralConfig("useTabs", Boolean.TRUE);

        assertEquals(120, lineLength);
        assertFalse(useTabs);
    }

    @Test
    void default_config_text_is_the_bundled_yaml() throws Exception {
        String text = ConfigurationLoader.defaultConfigText();

        assertTrue(text.contains("lineLength: 100"), text);
        assertTrue(text.contains("safetyChecks: true"), text);
    }
}
