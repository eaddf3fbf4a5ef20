package com.gdformatter.api.error;

public enum Severity {
    FATAL,   // The file could not be formatted at all
    ERROR,   // Formatting produced output that failed a safety check
    WARNING, // Formatting succeeded but something looks off
    INFO     // Informational messages about formatting
}
