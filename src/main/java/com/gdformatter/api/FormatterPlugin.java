package com.gdformatter.api;

import java.nio.file.Path;

import com.gdformatter.config.FormatterConfig;

/**
 * Interface for language-specific formatter plugins.
 */
public interface FormatterPlugin {
    /**
     * Initialize the plugin with the configuration.
     */
    void initialize(FormatterConfig config);

    /**
     * Format the provided source code. Never throws for bad input; problems
     * are reported through the result's errors.
     */
    FormatterResult format(Path filePath, String sourceCode);
}
