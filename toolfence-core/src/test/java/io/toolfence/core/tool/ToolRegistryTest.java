package io.toolfence.core.tool;

import static org.assertj.core.api.Assertions.assertThat;

import io.toolfence.core.model.ToolDefinition;
import io.toolfence.core.tool.impl.FilesystemTool;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolRegistryTest {

    @Test
    void shouldKeepRegistrationOrderAndExposeDefinitions() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new NamedTool("zeta"));
        registry.register(new NamedTool("alpha"));

        assertThat(registry.all()).extracting(Tool::name).containsExactly("zeta", "alpha");
        assertThat(registry.definitions()).extracting(ToolDefinition::name).containsExactly("zeta", "alpha");
        assertThat(registry.definitions().get(0).inputSchema()).containsEntry("type", "object");
    }

    @Test
    void shouldExposeSchemaKeysInDeclaredOrder() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new FilesystemTool());

        Map<String, Object> schema = registry.definitions().get(0).inputSchema();

        assertThat(schema.keySet()).containsExactly("type", "properties", "required");
        assertThat(((Map<String, ?>) schema.get("properties")).keySet()).containsExactly("action", "path", "content");
    }

    @Test
    void shouldReplaceToolWithSameName() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new NamedTool("echo"));
        NamedTool replacement = new NamedTool("echo");
        registry.register(replacement);

        assertThat(registry.all()).hasSize(1);
        assertThat(registry.find("echo")).containsSame(replacement);
        assertThat(registry.find("missing")).isEmpty();
    }

    private record NamedTool(String name) implements Tool {
        @Override
        public String description() {
            return "tool " + name;
        }

        @Override
        public Object execute(Map<String, Object> input, ToolContext context) {
            return name;
        }
    }
}
