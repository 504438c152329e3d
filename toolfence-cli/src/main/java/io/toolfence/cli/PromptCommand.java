package io.toolfence.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolfence.core.config.model.ToolFenceConfig;
import io.toolfence.core.model.ToolDefinition;
import io.toolfence.core.prompt.PromptOptions;
import io.toolfence.core.prompt.SystemPromptBuilder;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "prompt", description = "Render the tool-calling system prompt")
public final class PromptCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final CliContext context;

    @Option(names = {"-t", "--tools"}, description = "JSON file holding an array of tool definitions")
    Path toolsFile;

    @Option(names = {"-s", "--system"}, description = "Base system prompt")
    String systemPrompt;

    @Option(names = "--parallel", description = "Allow several independent calls per fence")
    Boolean parallel;

    public PromptCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ToolFenceConfig config = context.loadConfig();
            List<ToolDefinition> tools = toolsFile == null
                ? context.toolRegistry().definitions()
                : readDefinitions(toolsFile);
            boolean allowParallel = parallel != null ? parallel : config.protocol().allowParallelToolCalls();
            String base = systemPrompt != null ? systemPrompt : config.loop().systemPrompt();

            System.out.println(new SystemPromptBuilder().build(base, tools, new PromptOptions(allowParallel)));
            return 0;
        } catch (Exception e) {
            System.err.println("Prompt command failed: " + e.getMessage());
            return 1;
        }
    }

    static List<ToolDefinition> readDefinitions(Path file) throws IOException {
        JsonNode root = JSON.readTree(Files.readString(file));
        if (!root.isArray()) {
            throw new IllegalArgumentException("tools file must hold a JSON array");
        }
        List<ToolDefinition> definitions = new ArrayList<>();
        for (JsonNode node : root) {
            String name = node.path("name").asText("");
            if (name.isBlank()) {
                throw new IllegalArgumentException("every tool needs a name");
            }
            JsonNode description = node.get("description");
            definitions.add(new ToolDefinition(
                name,
                description == null || description.isNull() ? null : description.asText(),
                schemaOf(node)
            ));
        }
        return definitions;
    }

    private static Map<String, Object> schemaOf(JsonNode node) {
        for (String field : List.of("inputSchema", "input_schema", "parameters")) {
            JsonNode schema = node.get(field);
            if (schema != null && schema.isObject()) {
                return JSON.convertValue(schema, MAP_TYPE);
            }
        }
        return null;
    }
}
