package com.flowcraft.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowcraft.core.api.Flow;
import com.flowcraft.core.api.FlowEdge;
import com.flowcraft.core.api.FlowNode;
import com.flowcraft.core.api.NodeKind;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a JSON flow document into an immutable {@link Flow}.
 *
 * <p>
 * Expected shape:
 *
 * <pre>
 * {
 *   "id": "...", "name": "...", "metadata": { ... },
 *   "nodes": [ { "id": "...", "type": "question|action|message", "label": "...", "data": { ... } } ],
 *   "edges": [ { "id": "...", "source": "...", "target": "...", "viaLabel": "...", "data": { ... } } ]
 * }
 * </pre>
 *
 * Unknown properties are ignored; {@code via_label} is accepted as an alias.
 */
public final class FlowJsonReader {
    private final ObjectMapper mapper;

    public FlowJsonReader() {
        this(new ObjectMapper());
    }

    public FlowJsonReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Reads a JSON file. */
    public Flow read(Path path) throws IOException {
        return read(Files.readString(path));
    }

    /** Reads a JSON string. */
    public Flow read(String json) {
        FlowDefinition def;
        try {
            def = mapper.readValue(json, FlowDefinition.class);
        } catch (JsonProcessingException e) {
            throw new FlowFormatException("Malformed flow document: " + e.getOriginalMessage(), e);
        }
        if (def == null)
            throw new FlowFormatException("Empty flow document");
        return toFlow(def);
    }

    /** Converts a parsed definition, checking required fields. */
    public static Flow toFlow(FlowDefinition def) {
        require(def.getId(), "id");
        require(def.getName(), "name");
        if (def.getNodes() == null)
            throw new FlowFormatException("nodes: field required");

        List<FlowNode> nodes = new ArrayList<>(def.getNodes().size());
        for (int i = 0; i < def.getNodes().size(); i++) {
            FlowDefinition.NodeDef nd = def.getNodes().get(i);
            String loc = "nodes." + i;
            if (nd == null)
                throw new FlowFormatException(loc + ": node must be an object");
            require(nd.getId(), loc + ".id");
            require(nd.getType(), loc + ".type");
            NodeKind kind;
            try {
                kind = NodeKind.fromString(nd.getType());
            } catch (IllegalArgumentException e) {
                throw new FlowFormatException(loc + ".type: " + e.getMessage(), e);
            }
            nodes.add(new FlowNode(nd.getId(), kind, nd.getLabel(), nd.getData()));
        }

        List<FlowEdge> edges = new ArrayList<>();
        if (def.getEdges() != null) {
            for (int i = 0; i < def.getEdges().size(); i++) {
                FlowDefinition.EdgeDef ed = def.getEdges().get(i);
                String loc = "edges." + i;
                if (ed == null)
                    throw new FlowFormatException(loc + ": edge must be an object");
                require(ed.getSource(), loc + ".source");
                require(ed.getTarget(), loc + ".target");
                edges.add(new FlowEdge(ed.getId(), ed.getSource(), ed.getTarget(), ed.getViaLabel(), ed.getData()));
            }
        }
        return new Flow(def.getId(), def.getName(), nodes, edges, def.getMetadata());
    }

    private static void require(String value, String location) {
        if (value == null)
            throw new FlowFormatException(location + ": field required");
    }
}
