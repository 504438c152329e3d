package io.toolfence.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A tool as advertised to the model. {@code inputSchema} is opaque here; its key order is kept
 * and {@code null} values are allowed, as in any JSON Schema document.
 */
public record ToolDefinition(String name, String description, Map<String, Object> inputSchema) {

    public ToolDefinition {
        Objects.requireNonNull(name, "name must not be null");
        inputSchema = inputSchema == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(inputSchema));
    }

    public static ToolDefinition of(String name, String description) {
        return new ToolDefinition(name, description, null);
    }
}
