package com.flowcraft.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import java.util.Map;

/**
 * YAML backend on top of Jackson's YAML data format.
 *
 * <p>
 * Block style, no {@code ---} marker, quotes only where YAML needs them,
 * sequences indented under their key. Strings that look like numbers stay
 * quoted so ids and answers such as {@code "10"} read back as strings.
 */
public final class YamlFlowSerializer implements FlowSerializer {
    private final ObjectMapper mapper;

    public YamlFlowSerializer() {
        this(newYamlMapper());
    }

    public YamlFlowSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** The mapper configuration used for flow documents; also reads them back. */
    public static ObjectMapper newYamlMapper() {
        YAMLFactory factory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .disable(YAMLGenerator.Feature.SPLIT_LINES)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                .enable(YAMLGenerator.Feature.INDENT_ARRAYS_WITH_INDICATOR)
                .build();
        return new ObjectMapper(factory);
    }

    @Override
    public String render(Map<String, Object> document) {
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render flow document as YAML", e);
        }
    }
}
