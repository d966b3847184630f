package com.flowcraft.core.api;

import com.flowcraft.core.util.Values;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A conversational flow graph: ordered nodes, ordered edges and free-form
 * metadata.
 *
 * <p>
 * Node ids are expected to be unique but this is not enforced here; the
 * validator reports duplicates.
 */
public record Flow(String id, String name, List<FlowNode> nodes, List<FlowEdge> edges,
        Map<String, Object> metadata) {

    public Flow {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        metadata = Values.frozenCopy(metadata);
    }

    public static Builder builder(String id, String name) {
        return new Builder(id, name);
    }

    /** Fluent builder, mostly for tests and programmatic construction. */
    public static final class Builder {
        private final String id;
        private final String name;
        private final List<FlowNode> nodes = new ArrayList<>();
        private final List<FlowEdge> edges = new ArrayList<>();
        private Map<String, Object> metadata = Map.of();

        private Builder(String id, String name) {
            this.id = id;
            this.name = name;
        }

        public Builder node(FlowNode node) {
            nodes.add(node);
            return this;
        }

        public Builder node(String id, NodeKind kind) {
            return node(FlowNode.of(id, kind, null));
        }

        public Builder node(String id, NodeKind kind, Map<String, Object> data) {
            return node(FlowNode.of(id, kind, data));
        }

        public Builder edge(FlowEdge edge) {
            edges.add(edge);
            return this;
        }

        public Builder edge(String source, String target) {
            return edge(FlowEdge.of(source, target));
        }

        public Builder edge(String source, String target, String viaLabel) {
            return edge(FlowEdge.of(source, target, viaLabel));
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Flow build() {
            return new Flow(id, name, nodes, edges, metadata);
        }
    }
}
