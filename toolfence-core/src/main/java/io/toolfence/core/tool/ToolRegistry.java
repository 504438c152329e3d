package io.toolfence.core.tool;

import io.toolfence.core.model.ToolDefinition;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tools by name, in registration order so the rendered prompt is stable.
 */
public final class ToolRegistry {
    private final Map<String, Tool> tools = new LinkedHashMap<>();

    public synchronized void register(Tool tool) {
        tools.put(tool.name(), tool);
    }

    public synchronized Optional<Tool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public synchronized List<Tool> all() {
        return List.copyOf(tools.values());
    }

    public List<ToolDefinition> definitions() {
        return all().stream()
            .map(tool -> new ToolDefinition(tool.name(), tool.description(), tool.schema()))
            .toList();
    }
}
