package io.toolfence.core.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.toolfence.core.fence.FenceScanner;
import io.toolfence.core.fence.FenceSpan;
import io.toolfence.core.fence.FenceTag;
import io.toolfence.core.model.ToolResult;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes executed tool results into a {@code ```tool_result} fence, one compact JSON object
 * per line with fields {@code id}, {@code name}, {@code result}, {@code error}.
 */
public final class ToolResultFormatter {
    private static final Logger LOG = LoggerFactory.getLogger(ToolResultFormatter.class);

    private static final FenceScanner RESULT_SCANNER = FenceScanner.forTag(FenceTag.TOOL_RESULT);

    private final ObjectMapper mapper;

    public ToolResultFormatter() {
        this(new ObjectMapper());
    }

    public ToolResultFormatter(ObjectMapper mapper) {
        this.mapper = mapper == null ? new ObjectMapper() : mapper;
    }

    /**
     * Returns an empty string for no results; no fence is emitted in that case.
     */
    public String format(List<ToolResult> results) {
        if (results == null || results.isEmpty()) {
            return "";
        }
        StringJoiner fence = new StringJoiner("\n", FenceTag.TOOL_RESULT.opener() + "\n", "\n```");
        for (ToolResult result : results) {
            fence.add(toLine(result));
        }
        return fence.toString();
    }

    public String formatSingle(ToolResult result) {
        return result == null ? "" : format(List.of(result));
    }

    /**
     * Result lines of the first {@code ```tool_result} fence in {@code text}, in order, with blank
     * lines dropped. Empty when there is no complete result fence.
     */
    public static List<String> extractLines(String text) {
        if (text == null) {
            return List.of();
        }
        FenceSpan span = RESULT_SCANNER.findFence(text, 0);
        if (span == null) {
            return List.of();
        }
        List<String> lines = new ArrayList<>();
        for (String line : span.body(text).split("\r?\n")) {
            if (!line.isBlank()) {
                lines.add(line.strip());
            }
        }
        return List.copyOf(lines);
    }

    String toLine(ToolResult result) {
        ObjectNode line = mapper.createObjectNode();
        if (result.toolCallId() != null) {
            line.put("id", result.toolCallId());
        }
        line.put("name", result.toolName());
        line.set("result", toJson(result.result()));
        line.put("error", result.isError());
        try {
            return mapper.writeValueAsString(line);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tool result line", e);
        }
    }

    private JsonNode toJson(Object value) {
        if (value == null) {
            return mapper.nullNode();
        }
        try {
            JsonNode node = mapper.valueToTree(value);
            return node == null ? mapper.nullNode() : node;
        } catch (IllegalArgumentException e) {
            LOG.debug("Falling back to string form for result of type {}", value.getClass().getName(), e);
            return TextNode.valueOf(String.valueOf(value));
        }
    }
}
