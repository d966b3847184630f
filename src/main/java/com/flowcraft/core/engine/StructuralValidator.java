package com.flowcraft.core.engine;

import com.flowcraft.core.api.Flow;
import com.flowcraft.core.api.FlowEdge;
import com.flowcraft.core.api.FlowNode;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Certifies that a flow is structurally sound before a conversation engine
 * runs it.
 *
 * <p>
 * Every rule is evaluated and contributes plain-sentence errors (which make
 * the flow invalid) or warnings (advisory). Only an empty node list stops
 * evaluation early.
 *
 * <p>
 * Errors:
 * <ul>
 * <li>no nodes</li>
 * <li>duplicate node ids</li>
 * <li>edges with an unknown source or target</li>
 * <li>no start node (every node has an inbound edge)</li>
 * <li>no terminal message node</li>
 * <li>question edges labelled outside the expected answers</li>
 * <li>a cycle</li>
 * </ul>
 * Warnings: duplicate edges, several start nodes, message nodes with
 * outgoing edges, unreachable nodes.
 */
public final class StructuralValidator {
    private static final Logger log = LogManager.getLogger(StructuralValidator.class);

    public ValidationResult validate(Flow flow) {
        return validate(flow, GraphIndex.of(flow));
    }

    /**
     * Validates against a prebuilt index of the same flow.
     */
    public ValidationResult validate(Flow flow, GraphIndex index) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (flow.nodes().isEmpty()) {
            errors.add("Flow must contain at least one node.");
            return ValidationResult.of(errors, warnings);
        }

        checkDuplicateIds(flow, errors);
        checkEdges(flow, index, errors, warnings);
        checkEntryAndExit(index, errors, warnings);
        checkNodes(index, errors, warnings);

        new CycleDetector(index).describeCycle()
                .ifPresent(cycle -> errors.add("Cycle detected: " + cycle));

        List<String> unreachable = new ArrayList<>(new ReachabilityAnalyzer(index).unreachable());
        if (!unreachable.isEmpty()) {
            Collections.sort(unreachable);
            warnings.add("Unreachable nodes detected: " + String.join(", ", unreachable));
        }

        log.debug("Validated flow '{}': {} errors, {} warnings", flow.id(), errors.size(), warnings.size());
        return ValidationResult.of(errors, warnings);
    }

    private static void checkDuplicateIds(Flow flow, List<String> errors) {
        Set<String> seen = new HashSet<>();
        SortedSet<String> duplicates = new TreeSet<>();
        for (FlowNode node : flow.nodes()) {
            if (!seen.add(node.id()))
                duplicates.add(node.id());
        }
        if (!duplicates.isEmpty())
            errors.add("Duplicate node identifiers detected: " + String.join(", ", duplicates));
    }

    private static void checkEdges(Flow flow, GraphIndex index, List<String> errors, List<String> warnings) {
        // Raw label, so a missing label and an empty one are distinct signatures.
        Set<List<String>> signatures = new HashSet<>();
        for (FlowEdge edge : flow.edges()) {
            if (!index.contains(edge.source()))
                errors.add("Edge references unknown source node '" + edge.source() + "'.");
            if (!index.contains(edge.target()))
                errors.add("Edge references unknown target node '" + edge.target() + "'.");
            if (!signatures.add(Arrays.asList(edge.source(), edge.target(), edge.viaLabel()))) {
                warnings.add("Duplicate edge detected from '" + edge.source() + "' to '" + edge.target()
                        + "' with label '" + edge.labelOrEmpty() + "'.");
            }
        }
    }

    private static void checkEntryAndExit(GraphIndex index, List<String> errors, List<String> warnings) {
        int roots = index.roots().size();
        if (roots == 0)
            errors.add("Flow must contain at least one start node (no incoming edges).");
        else if (roots > 1)
            warnings.add("Multiple start nodes detected; execution order may be ambiguous.");

        if (index.terminals().isEmpty())
            errors.add("Flow must contain at least one terminal message node (message without outgoing edges).");
    }

    private static void checkNodes(GraphIndex index, List<String> errors, List<String> warnings) {
        for (FlowNode node : index.nodes()) {
            List<FlowEdge> outgoing = index.outbound(node.id());
            switch (node.kind()) {
                case MESSAGE -> {
                    if (!outgoing.isEmpty())
                        warnings.add("Message node '" + node.id()
                                + "' has outgoing edges and will not terminate the flow.");
                }
                case QUESTION -> checkAnswerLabels(node, outgoing, errors);
                case ACTION -> {
                    // no per-node rule
                }
            }
        }
    }

    private static void checkAnswerLabels(FlowNode node, List<FlowEdge> outgoing, List<String> errors) {
        Set<String> expected = new HashSet<>(node.expectedAnswers());
        if (expected.isEmpty())
            return;
        for (FlowEdge edge : outgoing) {
            if (edge.hasLabel() && !expected.contains(edge.viaLabel()))
                errors.add("Edge from question '" + node.id() + "' uses label '" + edge.viaLabel()
                        + "' not present in expected answers.");
        }
    }
}
