package com.gdformatter.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * Entry point for formatting sources, one file or a whole tree.
 */
public interface CodeFormatter {
    FormatterResult formatFile(Path filePath, String sourceCode);
    Map<Path, FormatterResult> formatDirectory(Path directory);
}
