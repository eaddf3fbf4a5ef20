package com.gdformatter.plugins.gdscript.parser;

import java.util.List;

/**
 * A source text together with its parse tree and comments.
 */
public final class ParsedScript {
    private final String source;
    private final Tree tree;
    private final List<CommentToken> comments;

    public ParsedScript(String source, Tree tree, List<CommentToken> comments) {
        this.source = source;
        this.tree = tree;
        this.comments = List.copyOf(comments);
    }

    public static ParsedScript parse(GdScriptParser parser, String source) throws GdScriptSyntaxException {
        return new ParsedScript(source, parser.parse(source), parser.parseComments(source));
    }

    public String getSource() { return source; }
    public Tree getTree() { return tree; }
    public List<CommentToken> getComments() { return comments; }
}
