package com.gdformatter.cli;

import com.gdformatter.api.FormatterResult;
import com.gdformatter.api.error.FormatterError;
import com.gdformatter.config.ConfigurationLoader;
import com.gdformatter.config.FormatterConfig;
import com.gdformatter.core.AdvancedCodeFormatter;
import com.gdformatter.plugins.FileType;
import com.gdformatter.plugins.gdscript.GdScriptFormatter;
import com.gdformatter.util.ErrorFormatter;
import com.gdformatter.util.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Command line interface of the GDScript formatter.
 */
public class FormatterCli {
    private static final Logger logger = LoggerUtil.getLogger(FormatterCli.class);
    private static final String VERSION = "1.0.0";
    private static final String CONFIG_FILE_NAME = ConfigurationLoader.DEFAULT_CONFIG_FILE;
    private static final String STDIN_PATH = "-";

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;
    private final Path workingDirectory;
    private ErrorFormatter errorFormatter = new ErrorFormatter(false);

    public FormatterCli(InputStream in, PrintStream out, PrintStream err, Path workingDirectory) {
        this.in = in;
        this.out = out;
        this.err = err;
        this.workingDirectory = workingDirectory;
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = new FormatterCli(System.in, System.out, System.err, Paths.get("")).run(args);
        } finally {
            LoggerUtil.shutdown();
        }
        System.exit(exitCode);
    }

    /**
     * Runs one command and returns the process exit code.
     */
    public int run(String[] args) {
        errorFormatter = new ErrorFormatter(!_hasOption(args, "--no-color"));

        if (args.length < 1) {
            _printUsage();
            return 1;
        }

        if (_hasOption(args, "--verbose")) {
            LoggerUtil.setConsoleLevel(Level.FINE);
        } else {
            LoggerUtil.setConsoleLevel(Level.INFO);
        }

        String command = args[0];
        try {
            switch (command) {
                case "format":
                    return _formatFiles(args, true);
                case "check":
                    return _formatFiles(args, false);
                case "init":
                    return _initializeConfig(args);
                case "--version":
                case "-v":
                    out.println("GDScript Formatter version " + VERSION);
                    return 0;
                case "--help":
                case "-h":
                    _printUsage();
                    return 0;
                default:
                    _printError("Unknown command: " + command);
                    _printUsage();
                    return 1;
            }
        } catch (IOException | RuntimeException e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);
            if (!_hasOption(args, "--verbose")) {
                _printError("Use --verbose for details in the log");
            }
            return 1;
        }
    }

    private void _printUsage() {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "GDScript Formatter CLI v" + VERSION));
        out.println("Usage:");
        out.println("  gdformatter init [--force]        - Write " + CONFIG_FILE_NAME + " with default settings");
        out.println("  gdformatter format <path|->       - Format files in path, '-' formats stdin to stdout");
        out.println("  gdformatter check <path>          - Report files that would be reformatted");
        out.println("  gdformatter --help|-h             - Show this help");
        out.println("  gdformatter --version|-v          - Show version information");
        out.println();
        out.println("Options:");
        out.println("  --config=<file>                   - Use specific config file (default: " + CONFIG_FILE_NAME + ")");
        out.println("  --line-length=<num>               - Maximum line length");
        out.println("  --use-spaces=<num>                - Indent with this many spaces instead of tabs");
        out.println("  --verbose                         - Show detailed output");
        out.println("  --ci                              - CI friendly output (simplified)");
        out.println("  --no-color                        - Disable colored output");
        out.println("  --include=<glob>                  - Only include files matching pattern");
        out.println("  --threads=<num>                   - Number of threads to use (default: available processors)");
        out.println("  --force                           - Force overwrite (with init command)");
    }

    private int _formatFiles(String[] args, boolean write) throws IOException {
        if (args.length < 2 || args[1].startsWith("--")) {
            _printError("Error: Missing path argument");
            _printUsage();
            return 1;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");
        FormatterConfig config = _loadConfig(args);

        try (AdvancedCodeFormatter formatter = _createFormatter(config)) {
            if (args[1].equals(STDIN_PATH)) {
                return write ? _formatStandardInput(formatter) : _checkStandardInput(formatter);
            }

            Path path = workingDirectory.resolve(args[1]);
            if (!Files.exists(path)) {
                _printError("Error: Path does not exist: " + args[1]);
                return 1;
            }

            List<Path> files = _findFiles(formatter, path, _getOptionValue(args, "--include"));
            if (!ciMode) {
                _printInfo("Found " + files.size() + " files to " + (write ? "format" : "check"));
            }

            Instant start = Instant.now();
            Map<Path, FormatterResult> results = formatter.formatFiles(files, _threadCount(args));

            int changedCount = 0;
            int unchangedCount = 0;
            Map<Path, List<FormatterError>> errorsByFile = new TreeMap<>();
            for (Path file : files) {
                FormatterResult result = results.get(file);
                if (result == null || !result.isSuccessful()) {
                    _printError((write ? "Failed to format: " : "Cannot check: ") + file);
                    List<FormatterError> errors = result == null ? List.of() : result.getErrors();
                    errors.forEach(e -> _printError("  " + errorFormatter.formatError(e)));
                    errorsByFile.put(file, errors);
                } else if (result.isChanged()) {
                    changedCount++;
                    if (write) {
                        Files.writeString(file, result.getFormattedCode(), StandardCharsets.UTF_8);
                        _printSuccess("Formatted: " + file);
                    } else {
                        _printWarning("File needs formatting: " + file);
                    }
                } else {
                    unchangedCount++;
                    if (verbose) {
                        _printInfo("  Already formatted: " + file);
                    }
                }
            }

            Duration duration = Duration.between(start, Instant.now());
            if (ciMode) {
                out.println("RESULT:files=" + files.size() + ";changed=" + changedCount
                        + ";unchanged=" + unchangedCount + ";errors=" + errorsByFile.size());
            } else {
                out.println();
                out.println((write ? "Formatting" : "Check") + " complete in " + _formatDuration(duration) + ":");
                out.println("  Processed files: " + files.size());
                out.println("  " + (write ? "Reformatted: " : "Would reformat: ") + changedCount);
                out.println("  Left unchanged: " + unchangedCount);
                out.println("  Files with errors: " + errorsByFile.size());
                if (!errorsByFile.isEmpty()) {
                    out.println();
                    out.println(errorFormatter.formatErrorSummary(errorsByFile));
                }
            }

            if (!errorsByFile.isEmpty()) {
                return 1;
            }
            return !write && changedCount > 0 ? 1 : 0;
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to release formatter resources", e);
        }
    }

    private int _formatStandardInput(AdvancedCodeFormatter formatter) throws IOException {
        String source = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        FormatterResult result = formatter.formatFile(Paths.get("stdin.gd"), source);
        if (!result.isSuccessful()) {
            result.getErrors().forEach(e -> _printError(errorFormatter.formatError(e)));
            return 1;
        }
        out.print(result.getFormattedCode());
        out.flush();
        return 0;
    }

    private int _checkStandardInput(AdvancedCodeFormatter formatter) throws IOException {
        String source = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        FormatterResult result = formatter.formatFile(Paths.get("stdin.gd"), source);
        if (!result.isSuccessful()) {
            result.getErrors().forEach(e -> _printError(errorFormatter.formatError(e)));
            return 1;
        }
        if (result.isChanged()) {
            _printWarning("stdin needs formatting");
            return 1;
        }
        return 0;
    }

    private int _initializeConfig(String[] args) throws IOException {
        Path configPath = workingDirectory.resolve(CONFIG_FILE_NAME);
        if (Files.exists(configPath) && !_hasOption(args, "--force")) {
            _printWarning("Configuration file already exists: " + CONFIG_FILE_NAME);
            out.println("Use --force to overwrite it");
            return 1;
        }

        Map<String, Object> overrides = _generalOverrides(args);
        if (overrides.isEmpty()) {
            Files.writeString(configPath, ConfigurationLoader.defaultConfigText(), StandardCharsets.UTF_8);
        } else {
            ConfigurationLoader.saveConfig(ConfigurationLoader.loadDefaultConfig().withGeneralOverrides(overrides),
                    configPath);
        }
        _printSuccess("Created configuration file: " + CONFIG_FILE_NAME);
        return 0;
    }

    private FormatterConfig _loadConfig(String[] args) {
        String configFile = _getOptionValue(args, "--config");
        FormatterConfig config;
        if (configFile != null) {
            config = ConfigurationLoader.loadConfig(workingDirectory.resolve(configFile));
        } else {
            Path defaultPath = workingDirectory.resolve(CONFIG_FILE_NAME);
            config = ConfigurationLoader.loadConfig(Files.exists(defaultPath) ? defaultPath : null);
        }
        Map<String, Object> overrides = _generalOverrides(args);
        return overrides.isEmpty() ? config : config.withGeneralOverrides(overrides);
    }

    /**
     * General settings given on the command line; invalid numbers are reported and skipped.
     */
    private Map<String, Object> _generalOverrides(String[] args) {
        Map<String, Object> overrides = new HashMap<>();
        Integer lineLength = _intOption(args, "--line-length", 1);
        if (lineLength != null) {
            overrides.put("lineLength", lineLength);
        }
        Integer spaces = _intOption(args, "--use-spaces", 1);
        if (spaces != null) {
            overrides.put("useTabs", false);
            overrides.put("indentSize", spaces);
        }
        return overrides;
    }

    private Integer _intOption(String[] args, String option, int minimum) {
        String value = _getOptionValue(args, option);
        if (value == null) {
            return null;
        }
        try {
            int parsed = Integer.parseInt(value);
            if (parsed >= minimum) {
                return parsed;
            }
        } catch (NumberFormatException e) {
            logger.fine("Not a number for " + option + ": " + value);
        }
        _printWarning("Invalid value for " + option + ": " + value + ", ignoring it");
        return null;
    }

    private int _threadCount(String[] args) {
        Integer threads = _intOption(args, "--threads", 1);
        return threads != null ? threads : Runtime.getRuntime().availableProcessors();
    }

    private AdvancedCodeFormatter _createFormatter(FormatterConfig config) {
        AdvancedCodeFormatter formatter = new AdvancedCodeFormatter(config);
        formatter.registerPlugin(FileType.GDSCRIPT, new GdScriptFormatter());
        return formatter;
    }

    private static List<Path> _findFiles(AdvancedCodeFormatter formatter, Path path, String includePattern)
            throws IOException {
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }
        return formatter.findFiles(path).stream()
                .filter(p -> _matchesIncludePattern(p, includePattern))
                .collect(Collectors.toList());
    }

    static boolean _matchesIncludePattern(Path file, String includePattern) {
        if (includePattern == null || includePattern.isEmpty()) {
            return true;
        }

        String fileName = file.getFileName().toString();

        if (includePattern.startsWith("*.")) {
            return fileName.endsWith(includePattern.substring(1));
        } else if (includePattern.contains("*")) {
            String regex = includePattern
                    .replace(".", "\\.")
                    .replace("*", ".*")
                    .replace("?", ".");
            return fileName.matches(regex);
        } else {
            return fileName.contains(includePattern);
        }
    }

    private static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    private static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    private static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;
        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        }
        return String.format("%d min %d sec", seconds / 60, seconds % 60);
    }

    private void _printSuccess(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private void _printError(String message) {
        err.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }

    private void _printWarning(String message) {
        err.println(errorFormatter.colorize(ErrorFormatter.ANSI_YELLOW, message));
    }

    private void _printInfo(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }
}
