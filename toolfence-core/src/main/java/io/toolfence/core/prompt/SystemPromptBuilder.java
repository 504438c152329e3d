package io.toolfence.core.prompt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolfence.core.fence.FenceTag;
import io.toolfence.core.model.ToolDefinition;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the system prompt that teaches a text-only model the fence protocol.
 */
public final class SystemPromptBuilder {
    static final String PREAMBLE = "You are a helpful AI assistant with access to tools.";
    static final String MISSING_DESCRIPTION = "No description provided.";
    private static final Map<String, Object> EMPTY_SCHEMA = emptySchema();

    private static final String SEQUENTIAL_INSTRUCTION =
        "Only request one tool call at a time. Wait for tool results before asking for another tool.";
    private static final String PARALLEL_INSTRUCTION =
        "You may return multiple tool calls in the array if they are independent and can be executed in parallel. "
            + "Only combine calls that do not depend on each other's results.";

    private final ObjectMapper mapper;

    public SystemPromptBuilder() {
        this(new ObjectMapper());
    }

    public SystemPromptBuilder(ObjectMapper mapper) {
        this.mapper = mapper == null ? new ObjectMapper() : mapper;
    }

    public String build(String systemPrompt, List<ToolDefinition> tools) {
        return build(systemPrompt, tools, PromptOptions.defaults());
    }

    /**
     * With no tools the prior prompt comes back untouched, or {@code ""} when it is absent or blank.
     * Otherwise the
     * trimmed prior prompt, when not blank, is followed by a blank line and the protocol
     * instructions.
     */
    public String build(String systemPrompt, List<ToolDefinition> tools, PromptOptions options) {
        if (tools == null || tools.isEmpty()) {
            return systemPrompt == null || systemPrompt.isBlank() ? "" : systemPrompt;
        }
        boolean parallel = options != null && options.allowParallelToolCalls();
        String body = instructionBody(toolsJson(tools), parallel);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            return systemPrompt.trim() + "\n\n" + body;
        }
        return body;
    }

    private static Map<String, Object> emptySchema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", Map.of());
        return Collections.unmodifiableMap(schema);
    }

    private String toolsJson(List<ToolDefinition> tools) {
        List<Map<String, Object>> listing = tools.stream()
            .map(tool -> {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("name", tool.name());
                entry.put("description", tool.description() == null ? MISSING_DESCRIPTION : tool.description());
                entry.put("parameters", tool.inputSchema() == null ? EMPTY_SCHEMA : tool.inputSchema());
                return entry;
            })
            .toList();
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(listing);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tool schemas must be JSON-serializable", e);
        }
    }

    private String instructionBody(String toolsJson, boolean parallel) {
        String callOpener = FenceTag.TOOL_CALL.opener();
        String resultOpener = FenceTag.TOOL_RESULT.opener();
        StringBuilder body = new StringBuilder()
            .append(PREAMBLE).append("\n\n")
            .append("# Available Tools\n")
            .append(toolsJson).append("\n\n")
            .append("# Tool Calling Instructions\n")
            .append(parallel ? PARALLEL_INSTRUCTION : SEQUENTIAL_INSTRUCTION).append("\n\n")
            .append("To call a tool, output JSON in this exact format inside a ").append(callOpener)
            .append(" code fence:\n\n")
            .append(callOpener).append('\n')
            .append("{\"name\": \"tool_name\", \"arguments\": {\"param1\": \"value1\", \"param2\": \"value2\"}}\n")
            .append("```\n\n");
        if (parallel) {
            body.append("For multiple parallel calls:\n\n")
                .append(callOpener).append('\n')
                .append("[{\"name\": \"tool1\", \"arguments\": {\"param\": \"value\"}}, ")
                .append("{\"name\": \"tool2\", \"arguments\": {\"param\": \"value\"}}]\n")
                .append("```\n\n");
        }
        body.append("Tool responses will be provided in ").append(resultOpener)
            .append(" fences. Each line contains JSON like:\n")
            .append(resultOpener).append('\n')
            .append("{\"id\": \"call_123\", \"name\": \"tool_name\", \"result\": {...}, \"error\": false}\n")
            .append("```\n")
            .append("Use the `result` payload (and treat `error` as a boolean flag) when continuing the conversation.\n\n")
            .append("Important:\n")
            .append("- Use exact tool and parameter names from the schema above\n")
            .append("- Arguments must be a valid JSON object matching the tool's parameters\n")
            .append("- You can include brief reasoning before or after the tool call\n")
            .append("- If no tool is needed, respond directly without tool_call fences");
        return body.toString();
    }
}
