package com.pipedef.definitions.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

/**
 * Renders definition models to YAML. Output is deterministic for a given object graph: property order
 * comes from {@code @JsonPropertyOrder} on the model classes, nulls are omitted, multi-line strings are
 * written as literal blocks.
 */
public final class YamlSerializer {

    private static final YAMLMapper MAPPER = YAMLMapper.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.LITERAL_BLOCK_STYLE)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    private YamlSerializer() {
    }

    /**
     * Serializes {@code value} to YAML.
     *
     * @throws IllegalArgumentException when the value cannot be serialized
     */
    public static String serialize(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + (value != null ? value.getClass().getName() : "null")
                    + " to YAML: " + e.getOriginalMessage(), e);
        }
    }
}
