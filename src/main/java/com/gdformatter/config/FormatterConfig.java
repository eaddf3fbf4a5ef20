package com.gdformatter.config;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the formatter: a general section plus one section per plugin.
 */
public class FormatterConfig {
    private final Map<String, Object> generalConfig;
    private final Map<String, Map<String, Object>> pluginConfigs;

    public FormatterConfig(Map<String, Object> generalConfig,
                           Map<String, Map<String, Object>> pluginConfigs) {
        this.generalConfig = generalConfig;
        this.pluginConfigs = pluginConfigs;
    }

    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    public Map<String, Map<String, Object>> getPluginConfigsMap() {
        Map<String, Map<String, Object>> result = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : pluginConfigs.entrySet()) {
            result.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public <T> T getGeneralConfig(String key, T defaultValue) {
        Object value = generalConfig.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (defaultValue instanceof Integer) {
            return value instanceof Number ? (T) Integer.valueOf(((Number) value).intValue()) : defaultValue;
        } else if (defaultValue instanceof Boolean) {
            return value instanceof Boolean ? (T) value : defaultValue;
        } else if (defaultValue instanceof String) {
            return (T) value.toString();
        } else if (defaultValue instanceof List) {
            return value instanceof List ? (T) value : defaultValue;
        }
        return (T) value;
    }

    @SuppressWarnings("unchecked")
    public <T> T getPluginConfig(String plugin, String key, T defaultValue) {
        Map<String, Object> pluginConfig = pluginConfigs.get(plugin);
        if (pluginConfig == null) {
            return defaultValue;
        }

        Object value = pluginConfig.get(key);
        if (value == null) {
            return defaultValue;
        }

        if (defaultValue != null && !defaultValue.getClass().isInstance(value)) {
            if (defaultValue instanceof Integer && value instanceof Number) {
                return (T) Integer.valueOf(((Number) value).intValue());
            } else if (defaultValue instanceof Boolean && value instanceof String) {
                return (T) Boolean.valueOf(value.toString());
            } else if (defaultValue instanceof String) {
                return (T) value.toString();
            }
            return defaultValue;
        }

        return (T) value;
    }

    /**
     * Copy with some general settings replaced, used for command line overrides.
     */
    public FormatterConfig withGeneralOverrides(Map<String, Object> overrides) {
        Map<String, Object> general = new HashMap<>(generalConfig);
        general.putAll(overrides);
        return new FormatterConfig(general, getPluginConfigsMap());
    }
}
