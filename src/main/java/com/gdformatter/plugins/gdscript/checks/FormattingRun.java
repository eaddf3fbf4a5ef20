package com.gdformatter.plugins.gdscript.checks;

import java.util.List;

import com.gdformatter.plugins.gdscript.format.FormattingOptions;
import com.gdformatter.plugins.gdscript.parser.CommentToken;
import com.gdformatter.plugins.gdscript.parser.GdScriptSyntaxException;
import com.gdformatter.plugins.gdscript.parser.ParsedScript;
import com.gdformatter.plugins.gdscript.parser.Tree;

/**
 * One finished format run: the parsed input and the output. The output is
 * parsed on first request and shared by every check of the run.
 */
public final class FormattingRun {
    private final ParsedScript original;
    private final String formattedCode;
    private final FormattingOptions options;
    private final ScriptParser scriptParser;
    private ParsedScript formattedScript;

    public FormattingRun(ParsedScript original, String formattedCode, FormattingOptions options,
                         ScriptParser scriptParser) {
        this.original = original;
        this.formattedCode = formattedCode;
        this.options = options;
        this.scriptParser = scriptParser;
    }

    public String getOriginalCode() { return original.getSource(); }
    public Tree getOriginalTree() { return original.getTree(); }
    public List<CommentToken> getOriginalComments() { return original.getComments(); }
    public String getFormattedCode() { return formattedCode; }
    public FormattingOptions getOptions() { return options; }

    /**
     * The formatted code, parsed. A syntax error is thrown again on every call.
     */
    public synchronized ParsedScript getFormattedScript() throws GdScriptSyntaxException {
        if (formattedScript == null) {
            formattedScript = scriptParser.parse(formattedCode);
        }
        return formattedScript;
    }
}
