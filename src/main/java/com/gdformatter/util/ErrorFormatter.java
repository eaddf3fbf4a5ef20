package com.gdformatter.util;

import com.gdformatter.api.error.FormatterError;
import com.gdformatter.api.error.Severity;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Renders formatter errors for the terminal, optionally with ANSI colors.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * One error as {@code SEVERITY: message (Line l, Column c)} plus an optional suggestion line.
     */
    public String formatError(FormatterError error) {
        StringBuilder sb = new StringBuilder();

        String severityStr = switch (error.getSeverity()) {
            case FATAL -> colorize(ANSI_RED, "FATAL");
            case ERROR -> colorize(ANSI_RED, "ERROR");
            case WARNING -> colorize(ANSI_YELLOW, "WARNING");
            case INFO -> colorize(ANSI_BLUE, "INFO");
        };

        sb.append(severityStr).append(": ");
        sb.append(error.getMessage());
        sb.append(" (Line ").append(error.getLine()).append(", Column ").append(error.getColumn()).append(")");

        if (error.getSuggestion() != null && !error.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: "))
                    .append(error.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * Per-file error counts followed by a total line.
     */
    public String formatErrorSummary(Map<Path, List<FormatterError>> fileErrors) {
        StringBuilder sb = new StringBuilder();
        sb.append(colorize(ANSI_BOLD, "Error Summary:")).append("\n");

        long[] totals = new long[Severity.values().length];

        for (Map.Entry<Path, List<FormatterError>> entry : fileErrors.entrySet()) {
            List<FormatterError> errors = entry.getValue();
            if (errors.isEmpty()) {
                continue;
            }

            long[] counts = new long[Severity.values().length];
            for (FormatterError error : errors) {
                counts[error.getSeverity().ordinal()]++;
                totals[error.getSeverity().ordinal()]++;
            }

            sb.append(entry.getKey().getFileName()).append(": ").append(_counts(counts)).append("\n");
        }

        sb.append("\nTotal: ").append(_counts(totals));
        return sb.toString();
    }

    private String _counts(long[] counts) {
        StringBuilder sb = new StringBuilder();
        for (Severity severity : Severity.values()) {
            long count = counts[severity.ordinal()];
            if (count == 0) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(", ");
            }
            String color = switch (severity) {
                case FATAL, ERROR -> ANSI_RED;
                case WARNING -> ANSI_YELLOW;
                case INFO -> ANSI_BLUE;
            };
            sb.append(colorize(color, count + " " + severity.name().toLowerCase()));
        }
        return sb.toString();
    }

    /**
     * Applies ANSI color to text if colors are enabled.
     */
    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }
}
