package com.flowcraft.core.api;

import java.util.Objects;

/**
 * One step of an enumerated conversational path.
 *
 * @param nodeId the node reached
 * @param via    label of the edge used to reach it, {@code null} for the
 *               first step and for unlabelled edges
 */
public record PathStep(String nodeId, String via) {

    public PathStep {
        Objects.requireNonNull(nodeId, "nodeId");
    }

    public static PathStep start(String nodeId) {
        return new PathStep(nodeId, null);
    }

    public boolean hasVia() {
        return via != null;
    }
}
