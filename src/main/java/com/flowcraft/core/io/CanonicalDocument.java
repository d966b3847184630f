package com.flowcraft.core.io;

import com.flowcraft.core.api.Flow;
import com.flowcraft.core.api.FlowEdge;
import com.flowcraft.core.api.FlowNode;
import com.flowcraft.core.engine.GraphIndex;
import com.flowcraft.core.util.Values;

import java.util.*;

/**
 * Builds the canonical document tree of a flow.
 *
 * <p>
 * The tree is made of insertion-ordered maps, lists and scalars, so any
 * renderer that walks it in order produces the same text for flows that
 * differ only in declaration order.
 *
 * <h3>Ordering</h3>
 * <ul>
 * <li>Nodes by kind rank (question, action, message), then by id.</li>
 * <li>Edges by source, target, then label (missing label sorts as "").</li>
 * <li>{@code metadata} and {@code parameters} keys lexicographically.</li>
 * </ul>
 *
 * <h3>The {@code next} field</h3>
 * A node with a single unlabelled edge gets a scalar {@code next}. A node
 * with no edges gets none. Otherwise {@code next} maps each label to its
 * target, using {@code default} for unlabelled edges.
 */
public final class CanonicalDocument {
    public static final String DEFAULT_LABEL = "default";

    public static final Comparator<FlowNode> NODE_ORDER = Comparator
            .comparingInt((FlowNode n) -> n.kind().rank())
            .thenComparing(FlowNode::id);

    public static final Comparator<FlowEdge> EDGE_ORDER = Comparator
            .comparing(FlowEdge::source)
            .thenComparing(FlowEdge::target)
            .thenComparing(FlowEdge::labelOrEmpty);

    private CanonicalDocument() {
        // Utility class
    }

    public static Map<String, Object> build(Flow flow) {
        return build(flow, GraphIndex.of(flow));
    }

    public static Map<String, Object> build(Flow flow, GraphIndex index) {
        List<FlowNode> sorted = new ArrayList<>(flow.nodes());
        sorted.sort(NODE_ORDER);

        Map<String, Object> flowMap = new LinkedHashMap<>();
        for (FlowNode node : sorted)
            flowMap.put(node.id(), entry(node, index.outbound(node.id())));

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("id", flow.id());
        document.put("name", flow.name());
        if (!flow.metadata().isEmpty())
            document.put("metadata", Values.sortedCopy(flow.metadata()));
        document.put("flow", flowMap);
        return document;
    }

    static Map<String, Object> entry(FlowNode node, List<FlowEdge> edges) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("type", node.kind().wireName());
        switch (node.kind()) {
            case QUESTION -> {
                putIfSet(entry, "question", node.field(FlowNode.QUESTION));
                putIfSet(entry, "check", node.field(FlowNode.CHECK));
                if (node.field(FlowNode.EXPECTED_ANSWERS) instanceof Collection<?> c && !c.isEmpty())
                    entry.put("expected_answers", Values.asStringList(c));
                putNext(entry, edges);
                putSortedIfNonEmpty(entry, "metadata", node.metadata());
            }
            case ACTION -> {
                putIfSet(entry, "action", node.field(FlowNode.ACTION));
                putSortedIfNonEmpty(entry, "parameters", node.parameters());
                putNext(entry, edges);
                putSortedIfNonEmpty(entry, "metadata", node.metadata());
            }
            case MESSAGE -> {
                putIfSet(entry, "message", node.field(FlowNode.MESSAGE));
                putIfSet(entry, "severity", node.field(FlowNode.SEVERITY));
                putSortedIfNonEmpty(entry, "metadata", node.metadata());
                putNext(entry, edges);
            }
        }
        return entry;
    }

    /**
     * The {@code next} value for a node's outgoing edges: a target id, a
     * label-to-target map, or {@code null} when there are no edges.
     */
    static Object next(List<FlowEdge> edges) {
        if (edges.isEmpty())
            return null;
        if (edges.size() == 1 && !edges.get(0).hasLabel())
            return edges.get(0).target();

        List<FlowEdge> sorted = new ArrayList<>(edges);
        sorted.sort(EDGE_ORDER);
        Map<String, Object> next = new LinkedHashMap<>();
        for (FlowEdge edge : sorted)
            next.put(edge.hasLabel() ? edge.viaLabel() : DEFAULT_LABEL, edge.target());
        return next;
    }

    private static void putNext(Map<String, Object> entry, List<FlowEdge> edges) {
        Object next = next(edges);
        if (next != null)
            entry.put("next", next);
    }

    private static void putIfSet(Map<String, Object> entry, String key, Object value) {
        if (Values.isSet(value))
            entry.put(key, value);
    }

    private static void putSortedIfNonEmpty(Map<String, Object> entry, String key, Map<String, Object> map) {
        if (!map.isEmpty())
            entry.put(key, Values.sortedCopy(map));
    }
}
