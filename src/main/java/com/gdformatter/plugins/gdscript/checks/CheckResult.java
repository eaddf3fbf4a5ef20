package com.gdformatter.plugins.gdscript.checks;

import java.util.List;

import com.gdformatter.api.error.FormatterError;
import com.gdformatter.api.error.Severity;

/**
 * Result of a safety check; empty when the check passed.
 */
public class CheckResult {
    private final List<FormatterError> errors;

    public CheckResult(List<FormatterError> errors) {
        this.errors = List.copyOf(errors);
    }

    public static CheckResult passed() {
        return new CheckResult(List.of());
    }

    public static CheckResult failed(String message, int line, String suggestion) {
        return new CheckResult(List.of(new FormatterError(Severity.ERROR, message, line, 1, suggestion)));
    }

    public List<FormatterError> getErrors() {
        return errors;
    }

    public boolean isPassed() {
        return errors.isEmpty();
    }
}
