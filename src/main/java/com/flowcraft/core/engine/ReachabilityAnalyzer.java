package com.flowcraft.core.engine;

import com.flowcraft.core.api.FlowEdge;

import java.util.*;

/**
 * Forward reachability from the roots of a flow.
 */
public final class ReachabilityAnalyzer {
    private final GraphIndex index;

    public ReachabilityAnalyzer(GraphIndex index) {
        this.index = index;
    }

    /** Ids of every declared node reachable from some root, roots included. */
    public Set<String> reachable() {
        Set<String> visited = new HashSet<>(index.nodeCount() * 2);
        Deque<String> work = new ArrayDeque<>(index.roots());
        while (!work.isEmpty()) {
            String id = work.pop();
            if (!visited.add(id))
                continue;
            for (FlowEdge edge : index.outbound(id)) {
                if (index.contains(edge.target()) && !visited.contains(edge.target()))
                    work.push(edge.target());
            }
        }
        return visited;
    }

    /** Declared node ids no root can reach, in declaration order. */
    public List<String> unreachable() {
        Set<String> visited = reachable();
        List<String> out = new ArrayList<>();
        for (String id : index.nodeIds())
            if (!visited.contains(id))
                out.add(id);
        return out;
    }
}
