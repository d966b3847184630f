package com.flowcraft.core.engine;

import com.flowcraft.core.api.Flow;
import com.flowcraft.core.api.FlowEdge;
import com.flowcraft.core.api.PathStep;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Enumerates every simple path from a root to a terminal message node.
 *
 * <p>
 * Backtracking search: each root starts a path; reaching a terminal records a
 * copy of the current path; an edge is followed only if its target is a
 * declared node not already on the path. A branch longer than
 * {@link #MAX_PATH_DEPTH} steps is abandoned, the rest of the search goes on.
 * The input does not have to pass validation first, so cyclic graphs are
 * expected here.
 *
 * <p>
 * Runs on an explicit frame stack; paths come out in the same order as a
 * recursive depth-first walk over edges in declaration order.
 */
@Log4j2
public final class PathEnumerator {
    public static final int MAX_PATH_DEPTH = 1000;

    private static final class Frame {
        final String nodeId;
        final int depth;
        int cursor;

        Frame(String nodeId, int depth) {
            this.nodeId = nodeId;
            this.depth = depth;
        }
    }

    private final GraphIndex index;
    private final int maxDepth;

    public PathEnumerator(GraphIndex index) {
        this(index, MAX_PATH_DEPTH);
    }

    PathEnumerator(GraphIndex index, int maxDepth) {
        this.index = index;
        this.maxDepth = maxDepth;
    }

    public static List<List<PathStep>> enumerate(Flow flow) {
        return new PathEnumerator(GraphIndex.of(flow)).enumerate();
    }

    public List<List<PathStep>> enumerate() {
        if (index.nodeCount() == 0 || index.roots().isEmpty() || index.terminals().isEmpty())
            return List.of();

        List<List<PathStep>> results = new ArrayList<>();
        for (String root : index.roots())
            walk(root, results);
        log.debug("Enumerated {} paths from {} roots", results.size(), index.roots().size());
        return results;
    }

    private void walk(String root, List<List<PathStep>> results) {
        Deque<Frame> stack = new ArrayDeque<>();
        List<PathStep> path = new ArrayList<>();
        Set<String> onPath = new HashSet<>();

        enter(PathStep.start(root), 1, stack, path, onPath, results);
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            List<FlowEdge> edges = index.outbound(top.nodeId);
            if (top.cursor < edges.size()) {
                FlowEdge edge = edges.get(top.cursor++);
                String target = edge.target();
                if (!index.contains(target) || onPath.contains(target))
                    continue;
                PathStep step = new PathStep(target, edge.hasLabel() ? edge.viaLabel() : null);
                enter(step, top.depth + 1, stack, path, onPath, results);
            } else {
                stack.pop();
                onPath.remove(path.remove(path.size() - 1).nodeId());
            }
        }
    }

    private void enter(PathStep step, int depth, Deque<Frame> stack, List<PathStep> path, Set<String> onPath,
            List<List<PathStep>> results) {
        if (depth > maxDepth)
            return;
        path.add(step);
        onPath.add(step.nodeId());
        if (index.isTerminal(step.nodeId()))
            results.add(List.copyOf(path));
        stack.push(new Frame(step.nodeId(), depth));
    }
}
