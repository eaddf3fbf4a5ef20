package com.gdformatter.plugins.gdscript.checks;

import com.gdformatter.plugins.gdscript.parser.GdScriptSyntaxException;
import com.gdformatter.plugins.gdscript.parser.ParsedScript;

/**
 * Where the checks get parse results from, usually a cache.
 */
@FunctionalInterface
public interface ScriptParser {
    ParsedScript parse(String source) throws GdScriptSyntaxException;
}
