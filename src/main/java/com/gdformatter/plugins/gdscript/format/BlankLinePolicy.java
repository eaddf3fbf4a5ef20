package com.gdformatter.plugins.gdscript.format;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.gdformatter.plugins.gdscript.parser.NodeKind;

/**
 * Blank line rules for one kind of block: how many consecutive blank lines
 * survive, and how many must surround statements of a given kind.
 */
public final class BlankLinePolicy {
    private final int maxConsecutive;
    private final Map<NodeKind, Integer> surrounding;

    public BlankLinePolicy(int maxConsecutive, Map<NodeKind, Integer> surrounding) {
        this.maxConsecutive = maxConsecutive;
        this.surrounding = surrounding.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(surrounding));
    }

    /**
     * Policy with the same count around classes and functions.
     */
    public static BlankLinePolicy around(int maxConsecutive, int aroundClasses, int aroundFunctions) {
        Map<NodeKind, Integer> surrounding = new EnumMap<>(NodeKind.class);
        surrounding.put(NodeKind.CLASS_DEF, aroundClasses);
        surrounding.put(NodeKind.FUNC_DEF, aroundFunctions);
        surrounding.put(NodeKind.STATIC_FUNC_DEF, aroundFunctions);
        return new BlankLinePolicy(maxConsecutive, surrounding);
    }

    public int getMaxConsecutive() {
        return maxConsecutive;
    }

    public int requiredAround(NodeKind kind) {
        return surrounding.getOrDefault(kind, 0);
    }
}
