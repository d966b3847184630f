package com.flowcraft.core.api;

import com.flowcraft.core.util.Values;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single step of a conversational flow.
 *
 * <p>
 * The {@code data} map is open: besides the kind-specific fields read by the
 * accessors below it may carry any extra keys, which are kept as given.
 *
 * @param id    unique key of the node within its flow
 * @param kind  question, action or message
 * @param label optional display label
 * @param data  kind-specific fields plus free-form {@code metadata}
 */
public record FlowNode(String id, NodeKind kind, String label, Map<String, Object> data) {

    public static final String QUESTION = "question";
    public static final String CHECK = "check";
    public static final String EXPECTED_ANSWERS = "expectedAnswers";
    public static final String ACTION = "action";
    public static final String PARAMETERS = "parameters";
    public static final String MESSAGE = "message";
    public static final String SEVERITY = "severity";
    public static final String METADATA = "metadata";

    public FlowNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        data = Values.frozenCopy(data);
    }

    public static FlowNode of(String id, NodeKind kind, Map<String, Object> data) {
        return new FlowNode(id, kind, null, data);
    }

    public static FlowNode question(String id, Map<String, Object> data) {
        return of(id, NodeKind.QUESTION, data);
    }

    public static FlowNode action(String id, Map<String, Object> data) {
        return of(id, NodeKind.ACTION, data);
    }

    public static FlowNode message(String id, Map<String, Object> data) {
        return of(id, NodeKind.MESSAGE, data);
    }

    public boolean isMessage() {
        return kind == NodeKind.MESSAGE;
    }

    public Object field(String key) {
        return data.get(key);
    }

    /** Answers a question node accepts; empty when none are declared. */
    public List<String> expectedAnswers() {
        return Values.asStringList(data.get(EXPECTED_ANSWERS));
    }

    public Map<String, Object> parameters() {
        return Values.asMap(data.get(PARAMETERS));
    }

    public Map<String, Object> metadata() {
        return Values.asMap(data.get(METADATA));
    }
}
