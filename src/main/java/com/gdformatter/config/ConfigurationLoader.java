package com.gdformatter.config;

import com.gdformatter.util.LoggerUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads the YAML configuration, filling in defaults and dropping values
 * that are out of range.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";
    public static final String DEFAULT_CONFIG_FILE = ".gdformatter.yml";

    static final String GDSCRIPT_PLUGIN = "gdscript";
    private static final List<String> BLANK_LINE_SCOPES = List.of("topLevel", "classBody", "functionBody");
    private static final List<String> BLANK_LINE_KEYS = List.of("maxConsecutive", "class", "func");

    private static FormatterConfig _cachedDefaultConfig = null;

    /**
     * Loads configuration from a file with fallback to defaults.
     */
    public static FormatterConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.fine("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.warning("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        try {
            logger.info("Loading configuration from: " + configPath);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(configPath.toFile(), Map.class);

            FormatterConfig formatterConfig = _createConfigFromMap(config == null ? new HashMap<>() : config);
            logger.fine("Configuration loaded with " +
                    formatterConfig.getPluginConfigsMap().size() + " plugin configurations");

            return formatterConfig;
        } catch (IOException e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the embedded default configuration, once.
     */
    public static synchronized FormatterConfig loadDefaultConfig() {
        if (_cachedDefaultConfig != null) {
            return _cachedDefaultConfig;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return _createEmptyConfig();
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);

            _cachedDefaultConfig = _createConfigFromMap(config);
            logger.fine("Default configuration loaded");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return _createEmptyConfig();
        }
    }

    /**
     * Raw text of the embedded default configuration, as written by {@code init}.
     */
    public static String defaultConfigText() throws IOException {
        try (InputStream in = ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (in == null) {
                throw new IOException("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Builds a configuration from the parsed YAML tree, validating and defaulting as it goes.
     */
    @SuppressWarnings("unchecked")
    private static FormatterConfig _createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> generalConfig = new HashMap<>();
        if (config.get("general") instanceof Map) {
            generalConfig = new HashMap<>((Map<String, Object>) config.get("general"));
        } else {
            logger.warning("Missing or invalid 'general' section in config, using defaults");
        }

        Map<String, Map<String, Object>> pluginConfigs = new HashMap<>();
        if (config.get("plugins") instanceof Map) {
            Map<String, Object> pluginsMap = (Map<String, Object>) config.get("plugins");

            for (Map.Entry<String, Object> entry : pluginsMap.entrySet()) {
                if (entry.getValue() instanceof Map) {
                    pluginConfigs.put(entry.getKey(), new HashMap<>((Map<String, Object>) entry.getValue()));
                } else {
                    logger.warning("Invalid configuration for plugin '" + entry.getKey() + "', using defaults");
                    pluginConfigs.put(entry.getKey(), new HashMap<>());
                }
            }
        } else {
            logger.warning("Missing or invalid 'plugins' section in config, using defaults");
        }

        _validateConfigurationValues(generalConfig, pluginConfigs);

        _ensureDefaultGeneralConfig(generalConfig);
        _ensureDefaultPluginConfigs(pluginConfigs);

        return new FormatterConfig(generalConfig, pluginConfigs);
    }

    /**
     * Drops out-of-range numbers and malformed {@code blankLines} sections.
     */
    @SuppressWarnings("unchecked")
    private static void _validateConfigurationValues(Map<String, Object> generalConfig,
                                                     Map<String, Map<String, Object>> pluginConfigs) {
        _validateIntRange(generalConfig, "indentSize", 1, 8);
        _validateIntRange(generalConfig, "lineLength", 40, 200);

        Map<String, Object> gdscriptConfig = pluginConfigs.get(GDSCRIPT_PLUGIN);
        if (gdscriptConfig == null) {
            return;
        }
        Object blankLines = gdscriptConfig.get("blankLines");
        if (blankLines == null) {
            return;
        }
        if (!(blankLines instanceof Map)) {
            logger.warning("Invalid 'blankLines' configuration, using defaults");
            gdscriptConfig.remove("blankLines");
            return;
        }
        Map<String, Object> scopes = new HashMap<>((Map<String, Object>) blankLines);
        for (String scope : BLANK_LINE_SCOPES) {
            if (scopes.containsKey(scope) && !(scopes.get(scope) instanceof Map)) {
                logger.warning("Invalid 'blankLines." + scope + "' configuration, using defaults");
                scopes.remove(scope);
            } else if (scopes.get(scope) instanceof Map) {
                Map<String, Object> counts = new HashMap<>((Map<String, Object>) scopes.get(scope));
                for (String key : BLANK_LINE_KEYS) {
                    _validateIntRange(counts, key, 0, 5);
                }
                scopes.put(scope, counts);
            }
        }
        gdscriptConfig.put("blankLines", scopes);
    }

    /**
     * Removes the value when it is not a number within {@code [min, max]}.
     */
    private static void _validateIntRange(Map<String, Object> config, String key, int min, int max) {
        if (!config.containsKey(key)) {
            return;
        }
        if (!(config.get(key) instanceof Number)) {
            logger.warning("Configuration value '" + key + "' is not a number. Using default value.");
            config.remove(key);
            return;
        }
        int value = ((Number) config.get(key)).intValue();
        if (value < min || value > max) {
            logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                    "(" + min + "-" + max + "). Using default value.");
            config.remove(key);
        }
    }

    /**
     * Configuration made of built-in defaults only, for when the bundled file cannot be read.
     */
    private static FormatterConfig _createEmptyConfig() {
        Map<String, Object> generalConfig = new HashMap<>();
        _ensureDefaultGeneralConfig(generalConfig);

        Map<String, Map<String, Object>> pluginConfigs = new HashMap<>();
        _ensureDefaultPluginConfigs(pluginConfigs);

        return new FormatterConfig(generalConfig, pluginConfigs);
    }

    /**
     * Fills in missing or mistyped general settings.
     */
    private static void _ensureDefaultGeneralConfig(Map<String, Object> generalConfig) {
        if (!(generalConfig.get("indentSize") instanceof Number)) {
            generalConfig.put("indentSize", 4);
        }
        if (!(generalConfig.get("useTabs") instanceof Boolean)) {
            generalConfig.put("useTabs", true);
        }
        if (!(generalConfig.get("lineLength") instanceof Number)) {
            generalConfig.put("lineLength", 100);
        }
        if (!(generalConfig.get("ignoreFiles") instanceof List)) {
            generalConfig.put("ignoreFiles", new ArrayList<String>());
        }
    }

    /**
     * Makes sure the gdscript plugin section exists with its switches set.
     */
    private static void _ensureDefaultPluginConfigs(Map<String, Map<String, Object>> pluginConfigs) {
        Map<String, Object> gdscriptConfig = pluginConfigs.computeIfAbsent(GDSCRIPT_PLUGIN, k -> new HashMap<>());
        if (!(gdscriptConfig.get("safetyChecks") instanceof Boolean)) {
            gdscriptConfig.put("safetyChecks", true);
        }
        if (!(gdscriptConfig.get("blankLines") instanceof Map)) {
            gdscriptConfig.put("blankLines", new HashMap<String, Object>());
        }
    }

    /**
     * Saves configuration to a file.
     */
    public static void saveConfig(FormatterConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<String, Object> configMap = new LinkedHashMap<>();
            configMap.put("general", config.getGeneralConfigMap());
            configMap.put("plugins", config.getPluginConfigsMap());

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
