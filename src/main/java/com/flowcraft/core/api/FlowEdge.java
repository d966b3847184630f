package com.flowcraft.core.api;

import com.flowcraft.core.util.Values;

import java.util.Map;
import java.util.Objects;

/**
 * A directed transition between two nodes.
 *
 * @param id       optional edge identifier
 * @param source   id of the node the transition leaves
 * @param target   id of the node the transition enters
 * @param viaLabel optional answer/branch label, distinguishes sibling edges
 * @param data     open extension map
 */
public record FlowEdge(String id, String source, String target, String viaLabel, Map<String, Object> data) {

    public FlowEdge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        data = Values.frozenCopy(data);
    }

    public static FlowEdge of(String source, String target) {
        return new FlowEdge(null, source, target, null, null);
    }

    public static FlowEdge of(String source, String target, String viaLabel) {
        return new FlowEdge(null, source, target, viaLabel, null);
    }

    /** An empty label counts as no label. */
    public boolean hasLabel() {
        return viaLabel != null && !viaLabel.isEmpty();
    }

    public String labelOrEmpty() {
        return viaLabel == null ? "" : viaLabel;
    }

    @Override
    public String toString() {
        return source + " -[" + labelOrEmpty() + "]-> " + target;
    }
}
