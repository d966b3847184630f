package com.flowcraft.core.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a flow as authors submit it (JSON).
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class FlowDefinition {
    private String id, name;
    private List<NodeDef> nodes;
    private List<EdgeDef> edges;
    private Map<String, Object> metadata;

    /** Definition of a single node. {@code type} is the node kind. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        private String id, type, label;
        private Map<String, Object> data;
    }

    /** Definition of a single transition. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class EdgeDef {
        private String id, source, target;
        @JsonAlias("via_label")
        private String viaLabel;
        private Map<String, Object> data;
    }
}
