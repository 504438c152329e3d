package io.toolfence.core.tool;

import java.util.LinkedHashMap;
import java.util.Map;

public interface Tool {
    String name();

    String description();

    /**
     * JSON Schema for the input. Return an insertion-ordered map so the prompt stays stable.
     */
    default Map<String, Object> schema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", Map.of());
        return schema;
    }

    /**
     * Returns any JSON-serializable value. Failures are reported by throwing; the caller turns them
     * into error results.
     */
    Object execute(Map<String, Object> input, ToolContext context);
}
