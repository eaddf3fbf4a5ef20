package com.gdformatter.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.gdformatter.api.CodeFormatter;
import com.gdformatter.api.FormatterPlugin;
import com.gdformatter.api.FormatterResult;
import com.gdformatter.api.error.FormatterError;
import com.gdformatter.api.error.Severity;
import com.gdformatter.config.FormatterConfig;
import com.gdformatter.plugins.FileType;
import com.gdformatter.util.LoggerUtil;

/**
 * Thread-safe orchestrator of the formatting process. Delegates each file
 * to the plugin registered for its file type and formats directories on a
 * fixed thread pool.
 */
public class AdvancedCodeFormatter implements CodeFormatter, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(AdvancedCodeFormatter.class);

    private final Map<FileType, FormatterPlugin> plugins = new ConcurrentHashMap<>();
    private final FormatterConfig config;
    private final List<PathMatcher> ignoreMatchers;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public AdvancedCodeFormatter(FormatterConfig config) {
        this.config = config;
        this.ignoreMatchers = _globMatchers(config.getGeneralConfig("ignoreFiles", List.of()));
        logger.fine("Formatter initialized with " + ignoreMatchers.size() + " ignore patterns");
    }

    public void registerPlugin(FileType fileType, FormatterPlugin plugin) {
        plugins.put(fileType, plugin);
        plugin.initialize(config);
        logger.fine("Registered plugin for file type: " + fileType.getDescription());
    }

    /**
     * Formats a single file using the appropriate plugin. Unexpected
     * exceptions become a FATAL result that carries the input unchanged.
     */
    @Override
    public FormatterResult formatFile(Path filePath, String sourceCode) {
        FileType fileType = FileType.detect(filePath);
        FormatterPlugin plugin = plugins.get(fileType);

        if (plugin == null) {
            logger.warning("No plugin found for file type: " + fileType + " - " + filePath);
            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(sourceCode)
                    .addError(new FormatterError(
                            Severity.ERROR,
                            "No plugin registered for file type: " + fileType,
                            1, 1))
                    .build();
        }

        try {
            processedFileCount.incrementAndGet();
            FormatterResult result = plugin.format(filePath, sourceCode);

            if (result.isSuccessful()) {
                successCount.incrementAndGet();
                logger.fine((result.isChanged() ? "Formatted: " : "Already formatted: ") + filePath);
            } else {
                errorCount.incrementAndGet();
                logger.warning("Failed to format: " + filePath + " - " +
                        result.getErrors().stream()
                                .map(e -> e.getSeverity() + ": " + e.getMessage())
                                .collect(Collectors.joining(", ")));
            }

            return result;
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error formatting file: " + filePath, e);

            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(sourceCode)
                    .addError(new FormatterError(
                            Severity.FATAL,
                            "Unexpected error: " + e.getMessage(),
                            1, 1))
                    .build();
        }
    }

    @Override
    public Map<Path, FormatterResult> formatDirectory(Path directory) {
        return formatDirectory(directory, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Formats every supported, non-ignored file under a directory with the given thread count.
     */
    public Map<Path, FormatterResult> formatDirectory(Path directory, int threadCount) {
        try {
            return formatFiles(findFiles(directory), threadCount);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error scanning directory: " + directory, e);
            return new ConcurrentHashMap<>();
        }
    }

    /**
     * Reads and formats the given files on a fixed thread pool. Nothing is written back.
     */
    public Map<Path, FormatterResult> formatFiles(List<Path> filesToProcess, int threadCount) {
        ConcurrentHashMap<Path, FormatterResult> results = new ConcurrentHashMap<>();
        logger.info("Found " + filesToProcess.size() + " files to process");
        if (filesToProcess.isEmpty()) {
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threadCount));
        try {
            for (Path file : filesToProcess) {
                executor.submit(() -> {
                    try {
                        String content = Files.readString(file, StandardCharsets.UTF_8);
                        results.put(file, formatFile(file, content));
                    } catch (IOException e) {
                        errorCount.incrementAndGet();
                        results.put(file, FormatterResult.fatal("Failed to read file: " + e.getMessage(), 1, 1));
                    } catch (RuntimeException e) {
                        logger.log(Level.SEVERE, "Unexpected error processing file: " + file, e);
                        results.put(file, FormatterResult.fatal("Unexpected error: " + e.getMessage(), 1, 1));
                    }
                });
            }
        } finally {
            executor.shutdown();
        }

        try {
            if (!executor.awaitTermination(30, TimeUnit.MINUTES)) {
                logger.warning("Timeout waiting for file processing to complete");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.log(Level.WARNING, "Processing interrupted", e);
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }

        logger.info("Processed " + results.size() + " files");
        return results;
    }

    /**
     * Supported files under a directory, minus the ignored ones, in path order.
     */
    public List<Path> findFiles(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            logger.warning("Not a directory: " + directory);
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(path -> !isIgnored(directory.relativize(path)))
                    .filter(path -> {
                        FileType type = FileType.detect(path);
                        return type != FileType.UNKNOWN && plugins.containsKey(type);
                    })
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * Whether a path relative to the formatted root matches an ignore pattern.
     */
    public boolean isIgnored(Path relativePath) {
        Path normalized = Path.of(relativePath.toString().replace('\\', '/'));
        return ignoreMatchers.stream().anyMatch(m -> m.matches(normalized));
    }

    private static List<PathMatcher> _globMatchers(List<?> patterns) {
        List<PathMatcher> matchers = new ArrayList<>();
        for (Object pattern : patterns) {
            String glob = String.valueOf(pattern);
            try {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
                if (glob.endsWith("/*")) {
                    matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob + "*"));
                }
            } catch (IllegalArgumentException e) {
                logger.warning("Ignoring invalid ignore pattern '" + glob + "': " + e.getMessage());
            }
        }
        return matchers;
    }

    public int getProcessedFileCount() {
        return processedFileCount.get();
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    public boolean hasPluginFor(FileType fileType) {
        return plugins.containsKey(fileType);
    }

    public int getPluginCount() {
        return plugins.size();
    }

    /**
     * Closes all plugins and releases resources.
     */
    @Override
    public void close() throws Exception {
        logger.fine("Closing formatter: processed=" + processedFileCount.get() +
                ", success=" + successCount.get() + ", errors=" + errorCount.get());

        Exception firstException = null;

        for (Map.Entry<FileType, FormatterPlugin> entry : plugins.entrySet()) {
            FormatterPlugin plugin = entry.getValue();
            if (plugin instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) plugin).close();
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Error closing plugin for file type: " + entry.getKey(), e);
                    if (firstException == null) {
                        firstException = e;
                    }
                }
            }
        }

        plugins.clear();

        if (firstException != null) {
            throw firstException;
        }
    }
}
