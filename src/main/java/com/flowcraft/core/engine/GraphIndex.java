package com.flowcraft.core.engine;

import com.flowcraft.core.api.Flow;
import com.flowcraft.core.api.FlowEdge;
import com.flowcraft.core.api.FlowNode;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * GraphIndex -- inbound/outbound adjacency of a flow, keyed by node id.
 *
 * <p>
 * Built once per flow and shared by every analysis pass. Lookups are O(1)
 * hash lookups; construction is O(N+E).
 *
 * <h3>Dangling edges</h3>
 * An edge whose source or target is not a declared node is still recorded on
 * the side it owns (outbound under its source, inbound under its target), so
 * the validator can see it. Traversals check {@link #contains(String)} before
 * following an edge and silently skip unknown targets.
 *
 * <h3>Duplicate ids</h3>
 * Nodes are looked up through an insertion-ordered table: an id keeps the
 * position of its first declaration and the value of its last one.
 */
@Log4j2
public final class GraphIndex {
    private final Map<String, FlowNode> nodesById;
    private final Map<String, List<FlowEdge>> inbound;
    private final Map<String, List<FlowEdge>> outbound;

    // Derived once, declaration order.
    private final List<String> roots;
    private final List<String> terminals;

    private GraphIndex(Map<String, FlowNode> nodesById, Map<String, List<FlowEdge>> inbound,
            Map<String, List<FlowEdge>> outbound) {
        this.nodesById = nodesById;
        this.inbound = inbound;
        this.outbound = outbound;

        List<String> r = new ArrayList<>();
        List<String> t = new ArrayList<>();
        for (FlowNode node : nodesById.values()) {
            if (inbound(node.id()).isEmpty())
                r.add(node.id());
            if (node.isMessage() && outbound(node.id()).isEmpty())
                t.add(node.id());
        }
        this.roots = Collections.unmodifiableList(r);
        this.terminals = Collections.unmodifiableList(t);
    }

    public static GraphIndex of(Flow flow) {
        return of(flow.nodes(), flow.edges());
    }

    public static GraphIndex of(List<FlowNode> nodes, List<FlowEdge> edges) {
        Builder b = builder();
        for (FlowNode node : nodes)
            b.addNode(node);
        for (FlowEdge edge : edges)
            b.addEdge(edge);
        return b.build();
    }

    public int nodeCount() {
        return nodesById.size();
    }

    /** Whether the id belongs to a declared node. */
    public boolean contains(String nodeId) {
        return nodesById.containsKey(nodeId);
    }

    /** The node declared under this id, or {@code null}. */
    public FlowNode node(String nodeId) {
        return nodesById.get(nodeId);
    }

    /** Distinct declared nodes in first-declaration order. */
    public Collection<FlowNode> nodes() {
        return nodesById.values();
    }

    public Set<String> nodeIds() {
        return nodesById.keySet();
    }

    /** Edges entering the node, in declaration order. Empty for unknown ids. */
    public List<FlowEdge> inbound(String nodeId) {
        return inbound.getOrDefault(nodeId, List.of());
    }

    /** Edges leaving the node, in declaration order. Empty for unknown ids. */
    public List<FlowEdge> outbound(String nodeId) {
        return outbound.getOrDefault(nodeId, List.of());
    }

    /** Node ids with no inbound edge. */
    public List<String> roots() {
        return roots;
    }

    /** Message node ids with no outbound edge. */
    public List<String> terminals() {
        return terminals;
    }

    public boolean isTerminal(String nodeId) {
        FlowNode node = nodesById.get(nodeId);
        return node != null && node.isMessage() && outbound(nodeId).isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for the index. Never rejects input: unknown endpoints are kept.
     */
    public static final class Builder {
        private final Map<String, FlowNode> nodesById = new LinkedHashMap<>();
        private final Map<String, List<FlowEdge>> inbound = new HashMap<>();
        private final Map<String, List<FlowEdge>> outbound = new HashMap<>();
        private int edgeCount;

        public Builder addNode(FlowNode node) {
            nodesById.put(node.id(), node);
            inbound.computeIfAbsent(node.id(), k -> new ArrayList<>());
            outbound.computeIfAbsent(node.id(), k -> new ArrayList<>());
            return this;
        }

        public Builder addEdge(FlowEdge edge) {
            outbound.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge);
            inbound.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge);
            edgeCount++;
            return this;
        }

        public GraphIndex build() {
            Map<String, List<FlowEdge>> in = new HashMap<>(inbound.size() * 2);
            Map<String, List<FlowEdge>> out = new HashMap<>(outbound.size() * 2);
            inbound.forEach((k, v) -> in.put(k, List.copyOf(v)));
            outbound.forEach((k, v) -> out.put(k, List.copyOf(v)));
            log.debug("Indexed {} nodes and {} edges", nodesById.size(), edgeCount);
            return new GraphIndex(Collections.unmodifiableMap(new LinkedHashMap<>(nodesById)), in, out);
        }
    }
}
