package com.gdformatter.plugins.gdscript.format;

import com.gdformatter.plugins.gdscript.parser.NodeKind;

/**
 * A node reached a dispatcher that has no handler for its kind. This is a
 * defect in the grammar/formatter pairing, never a problem with the input.
 */
public class DispatchMismatchException extends IllegalStateException {
    private final NodeKind kind;

    public DispatchMismatchException(String dispatcher, NodeKind kind) {
        super("No " + dispatcher + " handler for node kind " + kind);
        this.kind = kind;
    }

    public NodeKind getKind() {
        return kind;
    }
}
