package com.gdformatter.plugins.gdscript.checks;

/**
 * Verifies that formatted output is safe to write back.
 */
public interface SafetyCheck {
    String getName();
    CheckResult check(FormattingRun run);
}
