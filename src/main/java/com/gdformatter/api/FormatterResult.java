package com.gdformatter.api;

import java.util.ArrayList;
import java.util.List;

import com.gdformatter.api.error.FormatterError;
import com.gdformatter.api.error.Severity;

/**
 * Result of a formatting operation.
 */
public class FormatterResult {
    private final boolean successful;
    private final String formattedCode;
    private final boolean changed;
    private final List<FormatterError> errors;

    private FormatterResult(Builder builder) {
        this.successful = builder.successful;
        this.formattedCode = builder.formattedCode;
        this.changed = builder.changed;
        this.errors = List.copyOf(builder.errors);
    }

    public boolean isSuccessful() {
        return successful;
    }

    public String getFormattedCode() {
        return formattedCode;
    }

    /**
     * Whether the formatted code differs from the input.
     */
    public boolean isChanged() {
        return changed;
    }

    public List<FormatterError> getErrors() {
        return errors;
    }

    public boolean hasErrorsOfSeverity(Severity severity) {
        return errors.stream().anyMatch(e -> e.getSeverity() == severity);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shorthand for a failed run carrying a single fatal error.
     */
    public static FormatterResult fatal(String message, int line, int column) {
        return builder()
                .successful(false)
                .addError(new FormatterError(Severity.FATAL, message, line, column))
                .build();
    }

    public static class Builder {
        private boolean successful;
        private String formattedCode;
        private boolean changed;
        private List<FormatterError> errors = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder formattedCode(String formattedCode) {
            this.formattedCode = formattedCode;
            return this;
        }

        public Builder changed(boolean changed) {
            this.changed = changed;
            return this;
        }

        public Builder addError(FormatterError error) {
            this.errors.add(error);
            return this;
        }

        public Builder errors(List<FormatterError> errors) {
            this.errors = new ArrayList<>(errors);
            return this;
        }

        public FormatterResult build() {
            return new FormatterResult(this);
        }
    }
}
