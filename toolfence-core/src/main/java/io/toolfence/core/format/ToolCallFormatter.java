package io.toolfence.core.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.toolfence.core.fence.FenceTag;
import io.toolfence.core.model.ParsedToolCall;
import java.util.List;
import java.util.StringJoiner;

/**
 * Writes calls the model made earlier back into a single {@code ```tool_call} fence, so a text-only
 * backend sees its own calls when the history is replayed.
 */
public final class ToolCallFormatter {
    private final ObjectMapper mapper;

    public ToolCallFormatter() {
        this(new ObjectMapper());
    }

    public ToolCallFormatter(ObjectMapper mapper) {
        this.mapper = mapper == null ? new ObjectMapper() : mapper;
    }

    public String format(List<ParsedToolCall> calls) {
        if (calls == null || calls.isEmpty()) {
            return "";
        }
        StringJoiner fence = new StringJoiner("\n", FenceTag.TOOL_CALL.opener() + "\n", "\n```");
        for (ParsedToolCall call : calls) {
            ObjectNode line = mapper.createObjectNode();
            line.put("name", call.toolName());
            line.set("arguments", inlineArguments(call.args()));
            line.put("id", call.toolCallId());
            try {
                fence.add(mapper.writeValueAsString(line));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize tool call " + call.toolName(), e);
            }
        }
        return fence.toString();
    }

    private JsonNode inlineArguments(JsonNode args) {
        if (args == null || !args.isTextual()) {
            return args;
        }
        try {
            JsonNode parsed = mapper.readTree(args.asText());
            return parsed != null && parsed.isContainerNode() ? parsed : args;
        } catch (JsonProcessingException e) {
            return args;
        }
    }
}
