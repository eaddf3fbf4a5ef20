package com.gdformatter.plugins.gdscript.format;

import java.util.Collections;

/**
 * The blank line policy for each scope kind.
 */
public final class BlankLinePolicies {
    private final BlankLinePolicy topLevel;
    private final BlankLinePolicy classBody;
    private final BlankLinePolicy functionBody;

    public BlankLinePolicies(BlankLinePolicy topLevel, BlankLinePolicy classBody, BlankLinePolicy functionBody) {
        this.topLevel = topLevel;
        this.classBody = classBody;
        this.functionBody = functionBody;
    }

    public static BlankLinePolicies defaults() {
        return new BlankLinePolicies(
                BlankLinePolicy.around(2, 2, 2),
                BlankLinePolicy.around(1, 1, 1),
                new BlankLinePolicy(1, Collections.emptyMap()));
    }

    public BlankLinePolicy getTopLevel() { return topLevel; }
    public BlankLinePolicy getClassBody() { return classBody; }
    public BlankLinePolicy getFunctionBody() { return functionBody; }
}
