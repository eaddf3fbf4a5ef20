package com.gdformatter.plugins.gdscript.checks;

import java.util.List;

import com.gdformatter.plugins.gdscript.format.GdScriptCodeFormatter;
import com.gdformatter.plugins.gdscript.parser.GdScriptSyntaxException;
import com.gdformatter.plugins.gdscript.parser.ParsedScript;

/**
 * Formatting the output again must not change it.
 */
public class IdempotenceCheck implements SafetyCheck {
    private final GdScriptCodeFormatter formatter;

    public IdempotenceCheck(GdScriptCodeFormatter formatter) {
        this.formatter = formatter;
    }

    @Override
    public String getName() {
        return "idempotence";
    }

    @Override
    public CheckResult check(FormattingRun run) {
        String again;
        try {
            ParsedScript formatted = run.getFormattedScript();
            again = formatter.formatCode(formatted.getSource(), run.getOptions(), formatted.getTree(),
                    formatted.getComments());
        } catch (GdScriptSyntaxException e) {
            return CheckResult.failed("Formatted code does not parse: " + e.getMessage(), e.getLine(),
                    "Report this input as a formatter bug");
        }
        if (again.equals(run.getFormattedCode())) {
            return CheckResult.passed();
        }
        int line = _firstDifferentLine(run.getFormattedCode(), again);
        return CheckResult.failed("Formatting is not stable: a second pass changes line " + line, line,
                "Report this input as a formatter bug");
    }

    private static int _firstDifferentLine(String first, String second) {
        List<String> a = first.lines().toList();
        List<String> b = second.lines().toList();
        int line = 0;
        while (line < a.size() && line < b.size() && a.get(line).equals(b.get(line))) {
            line++;
        }
        return line + 1;
    }
}
