package com.flowcraft.core;

import com.flowcraft.core.api.Flow;
import com.flowcraft.core.api.FlowEdge;
import com.flowcraft.core.api.FlowNode;
import com.flowcraft.core.api.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Shared sample flows for tests. */
public final class Flows {
    private Flows() {
    }

    /** start(question) -yes-> loop(action) -> start, start -no-> end(message). */
    public static Flow cycle() {
        return Flow.builder("flow", "Flow")
                .node("start", NodeKind.QUESTION, Map.of("question", "Begin?", "expectedAnswers", List.of("yes", "no")))
                .node("loop", NodeKind.ACTION, Map.of("action", "loop"))
                .node("end", NodeKind.MESSAGE, Map.of("message", "done"))
                .edge("start", "loop", "yes")
                .edge("loop", "start")
                .edge("start", "end", "no")
                .build();
    }

    /** q1 -maybe-> m1 where q1 only expects yes/no. */
    public static Flow badLabel() {
        return Flow.builder("flow", "Flow")
                .node("q1", NodeKind.QUESTION, Map.of("question", "Continue?", "expectedAnswers", List.of("yes", "no")))
                .node("m1", NodeKind.MESSAGE, Map.of("message", "done"))
                .edge("q1", "m1", "maybe")
                .build();
    }

    /** The sample flow whose canonical document is pinned in the serializer tests. */
    public static Flow sample() {
        return sample(false);
    }

    /** Same graph as {@link #sample()}; {@code shuffled} declares nodes, edges and map keys in another order. */
    public static Flow sample(boolean shuffled) {
        Map<String, Object> flowMeta = new LinkedHashMap<>();
        Map<String, Object> startData = new LinkedHashMap<>();
        if (shuffled) {
            flowMeta.put("version", 1);
            flowMeta.put("owner", "data-team");
            startData.put("metadata", Map.of("channel", "inbound"));
            startData.put("expectedAnswers", List.of("yes", "no"));
            startData.put("question", "Where to?");
        } else {
            flowMeta.put("owner", "data-team");
            flowMeta.put("version", 1);
            startData.put("question", "Where to?");
            startData.put("expectedAnswers", List.of("yes", "no"));
            startData.put("metadata", Map.of("channel", "inbound"));
        }

        FlowNode start = FlowNode.question("start", startData);
        FlowNode action = FlowNode.action("action",
                Map.of("action", "dispatch", "parameters", Map.of("timeout", 30)));
        FlowNode end = FlowNode.message("end", Map.of("message", "Completed", "severity", "info"));

        List<FlowNode> nodes = new ArrayList<>(shuffled ? List.of(end, action, start) : List.of(start, action, end));
        List<FlowEdge> edges = new ArrayList<>(List.of(
                FlowEdge.of("start", "action", "yes"),
                FlowEdge.of("start", "end", "no"),
                FlowEdge.of("action", "end")));
        if (shuffled)
            Collections.reverse(edges);
        return new Flow("sample-flow", "Sample flow", nodes, edges, flowMeta);
    }

    /** start fans out to {@code count} actions which all lead to one terminal. */
    public static Flow branching(int count) {
        Flow.Builder b = Flow.builder("flow", "Flow")
                .node("start", NodeKind.QUESTION, Map.of("question", "Begin?"))
                .node("terminal", NodeKind.MESSAGE, Map.of("message", "done"));
        for (int i = 0; i < count; i++) {
            String id = "branch_" + i;
            b.node(id, NodeKind.ACTION, Map.of("action", id));
            b.edge("start", id, String.valueOf(i));
            b.edge(id, "terminal");
        }
        return b.build();
    }

    /** n0(question) -> n1 ... -> n{length-1}(action) -> end(message). */
    public static Flow chain(int length) {
        Flow.Builder b = Flow.builder("chain", "Chain");
        for (int i = 0; i < length; i++)
            b.node("n" + i, i == 0 ? NodeKind.QUESTION : NodeKind.ACTION);
        b.node("end", NodeKind.MESSAGE);
        for (int i = 0; i < length - 1; i++)
            b.edge("n" + i, "n" + (i + 1));
        b.edge("n" + (length - 1), "end");
        return b.build();
    }
}
