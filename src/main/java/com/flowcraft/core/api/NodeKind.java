package com.flowcraft.core.api;

import java.util.Locale;

/**
 * The closed set of node kinds a conversational flow can contain.
 *
 * <p>
 * Declaration order doubles as the canonical serialization rank: questions
 * first, then actions, then messages.
 */
public enum NodeKind {
    QUESTION,
    ACTION,
    MESSAGE;

    /** Rank used when ordering nodes canonically. */
    public int rank() {
        return ordinal();
    }

    /** Lower-case name used in flow documents ({@code question}, ...). */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static NodeKind fromString(String text) {
        for (NodeKind k : NodeKind.values()) {
            if (k.name().equalsIgnoreCase(text)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown NodeKind: " + text);
    }
}
