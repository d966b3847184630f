package com.flowcraft.core.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowcraft.core.Flows;
import com.flowcraft.core.api.Flow;
import com.flowcraft.core.api.FlowNode;
import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class YamlFlowSerializerTest {

    private static final TypeReference<LinkedHashMap<String, Object>> TREE = new TypeReference<>() {
    };

    private final YamlFlowSerializer serializer = new YamlFlowSerializer();
    private final ObjectMapper yaml = YamlFlowSerializer.newYamlMapper();

    private Map<String, Object> readBack(String text) throws Exception {
        return yaml.readValue(text, TREE);
    }

    @Test
    public void testBlockStyleWithoutDocumentMarker() {
        String text = serializer.serialize(Flows.sample());

        assertTrue(text, text.startsWith("id: sample-flow\nname: Sample flow\n"));
        assertFalse(text.contains("---"));
        assertTrue(text, text.contains("\n    next: end\n"));
    }

    @Test
    public void testReadsBackToCanonicalTree() throws Exception {
        Flow flow = Flows.sample();
        Map<String, Object> document = CanonicalDocument.build(flow);

        Map<String, Object> parsed = readBack(serializer.serialize(flow));

        assertEquals(document, parsed);
        assertEquals(List.copyOf(document.keySet()), List.copyOf(parsed.keySet()));
        Map<?, ?> flowMap = (Map<?, ?>) parsed.get("flow");
        assertEquals(List.of("start", "action", "end"), List.copyOf(flowMap.keySet()));
        Map<?, ?> start = (Map<?, ?>) flowMap.get("start");
        assertEquals(List.of("type", "question", "expected_answers", "next", "metadata"),
                List.copyOf(start.keySet()));
        assertEquals(List.of("yes", "no"), List.copyOf(((Map<?, ?>) start.get("next")).keySet()));
    }

    @Test
    public void testSameContentAsPlainBackend() throws Exception {
        Flow flow = Flows.sample();
        String plain = new PlainFlowSerializer().serialize(flow);
        String lib = serializer.serialize(flow);

        assertEquals(readBack(plain), readBack(lib));
    }

    @Test
    public void testNumberLikeStringsStayStrings() throws Exception {
        Flow flow = Flow.builder("f", "F")
                .node(FlowNode.question("q", Map.of("question", "Pick", "expectedAnswers", List.of("1", "2"))))
                .node(FlowNode.message("10", Map.of("message", "one", "severity", "3.5")))
                .node(FlowNode.message("20", Map.of("message", "two")))
                .edge("q", "10", "1")
                .edge("q", "20", "2")
                .metadata(Map.of("version", 2))
                .build();

        Map<String, Object> parsed = readBack(serializer.serialize(flow));

        assertEquals(CanonicalDocument.build(flow), parsed);
        Map<?, ?> flowMap = (Map<?, ?>) parsed.get("flow");
        Map<?, ?> q = (Map<?, ?>) flowMap.get("q");
        assertEquals(List.of("1", "2"), q.get("expected_answers"));
        assertEquals("10", ((Map<?, ?>) q.get("next")).get("1"));
        assertEquals("3.5", ((Map<?, ?>) flowMap.get("10")).get("severity"));
        assertEquals(2, ((Map<?, ?>) parsed.get("metadata")).get("version"));
    }

    @Test
    public void testDeclarationOrderDoesNotChangeOutput() {
        assertEquals(serializer.serialize(Flows.sample()), serializer.serialize(Flows.sample(true)));
    }
}
