package io.toolfence.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.Objects;

/**
 * A tool call recovered from model text.
 *
 * <p>{@code args} is object-shaped when the model wrote a JSON object and a text node when it
 * wrote a string that is not itself JSON.
 */
public record ParsedToolCall(String toolCallId, String toolName, JsonNode args) {

    public ParsedToolCall {
        Objects.requireNonNull(toolCallId, "toolCallId must not be null");
        Objects.requireNonNull(toolName, "toolName must not be null");
        args = args == null ? JsonNodeFactory.instance.objectNode() : args;
    }
}
