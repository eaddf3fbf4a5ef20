package com.gdformatter.plugins.gdscript.format;

import com.gdformatter.plugins.gdscript.parser.Tree;

/**
 * Renders one statement node at the indentation of the given context.
 */
@FunctionalInterface
public interface StatementFormatter {
    Outcome format(Tree statement, Context context);
}
