package com.gdformatter.plugins.gdscript.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable parse tree node: a kind tag, ordered children (nodes or tokens)
 * and the source line span.
 */
public final class Tree implements SyntaxElement {
    private final NodeKind kind;
    private final List<SyntaxElement> children;
    private final int line;
    private final int endLine;

    public Tree(NodeKind kind, List<? extends SyntaxElement> children, int line, int endLine) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        this.line = line;
        this.endLine = endLine;
    }

    /**
     * Creates a node whose line span covers all of its children.
     */
    public static Tree of(NodeKind kind, List<? extends SyntaxElement> children) {
        if (children.isEmpty()) {
            throw new IllegalArgumentException("Cannot derive a line span for an empty " + kind);
        }
        int start = Integer.MAX_VALUE;
        int end = 0;
        for (SyntaxElement child : children) {
            start = Math.min(start, child.getLine());
            end = Math.max(end, child.getEndLine());
        }
        return new Tree(kind, children, start, end);
    }

    public NodeKind getKind() { return kind; }
    public List<SyntaxElement> getChildren() { return children; }
    @Override
    public int getLine() { return line; }
    @Override
    public int getEndLine() { return endLine; }

    public int size() {
        return children.size();
    }

    public SyntaxElement get(int index) {
        return children.get(index);
    }

    public Tree child(int index) {
        SyntaxElement element = children.get(index);
        if (!(element instanceof Tree)) {
            throw new IllegalStateException(kind + " child " + index + " is a token: " + element);
        }
        return (Tree) element;
    }

    public Token token(int index) {
        SyntaxElement element = children.get(index);
        if (!(element instanceof Token)) {
            throw new IllegalStateException(kind + " child " + index + " is a node: " + element);
        }
        return (Token) element;
    }

    public Tree last() {
        return child(children.size() - 1);
    }

    /**
     * Child nodes only, skipping leaf tokens.
     */
    public List<Tree> subtrees() {
        List<Tree> result = new ArrayList<>();
        for (SyntaxElement element : children) {
            if (element instanceof Tree) {
                result.add((Tree) element);
            }
        }
        return result;
    }

    /**
     * Structural equality ignoring positions. Parenthesis wrappers are
     * transparent, so a wrapped expression equals its bare form.
     */
    public boolean sameStructure(Tree other) {
        Tree left = unwrapParens(this);
        Tree right = unwrapParens(other);
        if (left.kind != right.kind || left.children.size() != right.children.size()) {
            return false;
        }
        for (int i = 0; i < left.children.size(); i++) {
            SyntaxElement a = left.children.get(i);
            SyntaxElement b = right.children.get(i);
            if (a instanceof Token) {
                if (!(b instanceof Token) || !((Token) a).sameContent((Token) b)) {
                    return false;
                }
            } else if (!(b instanceof Tree) || !((Tree) a).sameStructure((Tree) b)) {
                return false;
            }
        }
        return true;
    }

    private static Tree unwrapParens(Tree tree) {
        Tree current = tree;
        while (current.kind == NodeKind.PAREN) {
            current = current.child(0);
        }
        return current;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind).append('@').append(line).append('-').append(endLine).append('[');
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(children.get(i));
        }
        return sb.append(']').toString();
    }
}
