package com.flowcraft.core.engine;

import com.flowcraft.core.api.FlowEdge;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Finds the first cycle of a flow graph with a three-colour depth-first
 * search.
 *
 * <p>
 * Colours: WHITE (unvisited), GRAY (on the current DFS path), BLACK (fully
 * explored). The search starts from every root in declaration order and then
 * from any node still WHITE, so cycles in components with no root are found
 * too. The first edge that reaches a GRAY node ends the whole search.
 *
 * <p>
 * The DFS runs on an explicit stack of frames (node id plus the index of the
 * next outbound edge to try) rather than on the call stack. The visiting
 * order is the same as the recursive formulation.
 */
public final class CycleDetector {
    private static final Logger log = LogManager.getLogger(CycleDetector.class);

    static final String ARROW = " -> ";

    private enum Colour {
        WHITE, GRAY, BLACK
    }

    private static final class Frame {
        final String nodeId;
        int cursor;

        Frame(String nodeId) {
            this.nodeId = nodeId;
        }
    }

    private final GraphIndex index;

    public CycleDetector(GraphIndex index) {
        this.index = index;
    }

    /**
     * Returns the first cycle found as a node id path whose last element
     * repeats the first one (e.g. {@code [A, B, A]}), or empty when the graph
     * is acyclic.
     */
    public Optional<List<String>> findCycle() {
        Map<String, Colour> colour = new HashMap<>(index.nodeCount() * 2);
        for (String id : index.nodeIds())
            colour.put(id, Colour.WHITE);

        for (String root : index.roots()) {
            if (colour.get(root) == Colour.WHITE) {
                List<String> cycle = visit(root, colour);
                if (cycle != null)
                    return Optional.of(cycle);
            }
        }
        for (String id : index.nodeIds()) {
            if (colour.get(id) == Colour.WHITE) {
                List<String> cycle = visit(id, colour);
                if (cycle != null)
                    return Optional.of(cycle);
            }
        }
        return Optional.empty();
    }

    /** The first cycle formatted as {@code A -> B -> A}, or empty. */
    public Optional<String> describeCycle() {
        return findCycle().map(CycleDetector::format);
    }

    public static String format(List<String> cycle) {
        return String.join(ARROW, cycle);
    }

    private List<String> visit(String start, Map<String, Colour> colour) {
        Deque<Frame> stack = new ArrayDeque<>();
        // Mirrors the frames, bottom to top, for cheap suffix extraction.
        List<String> path = new ArrayList<>();

        colour.put(start, Colour.GRAY);
        stack.push(new Frame(start));
        path.add(start);

        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            List<FlowEdge> edges = index.outbound(top.nodeId);
            if (top.cursor < edges.size()) {
                String target = edges.get(top.cursor++).target();
                Colour c = colour.get(target);
                if (c == null)
                    continue; // dangling edge
                if (c == Colour.GRAY) {
                    List<String> cycle = new ArrayList<>(path.subList(path.indexOf(target), path.size()));
                    cycle.add(target);
                    log.debug("Cycle detected: {}", format(cycle));
                    return cycle;
                }
                if (c == Colour.WHITE) {
                    colour.put(target, Colour.GRAY);
                    stack.push(new Frame(target));
                    path.add(target);
                }
            } else {
                stack.pop();
                path.remove(path.size() - 1);
                colour.put(top.nodeId, Colour.BLACK);
            }
        }
        return null;
    }
}
