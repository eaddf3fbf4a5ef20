package com.gdformatter.plugins.gdscript.checks;

import com.gdformatter.plugins.gdscript.parser.GdScriptSyntaxException;
import com.gdformatter.plugins.gdscript.parser.Tree;

/**
 * The formatted code must parse to the same tree as the input, positions
 * and redundant parentheses aside.
 */
public class TreeEquivalenceCheck implements SafetyCheck {

    @Override
    public String getName() {
        return "tree-equivalence";
    }

    @Override
    public CheckResult check(FormattingRun run) {
        Tree formattedTree;
        try {
            formattedTree = run.getFormattedScript().getTree();
        } catch (GdScriptSyntaxException e) {
            return CheckResult.failed("Formatted code does not parse: " + e.getMessage(), e.getLine(),
                    "Report this input as a formatter bug");
        }
        if (!run.getOriginalTree().sameStructure(formattedTree)) {
            return CheckResult.failed("Formatting changed the meaning of the code", 1,
                    "Report this input as a formatter bug");
        }
        return CheckResult.passed();
    }
}
