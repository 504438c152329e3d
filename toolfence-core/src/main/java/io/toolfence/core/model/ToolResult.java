package io.toolfence.core.model;

import java.util.Objects;

public record ToolResult(String toolCallId, String toolName, Object result, boolean isError) {

    public ToolResult {
        Objects.requireNonNull(toolName, "toolName must not be null");
    }

    public static ToolResult success(String toolCallId, String toolName, Object result) {
        return new ToolResult(toolCallId, toolName, result, false);
    }

    public static ToolResult error(String toolCallId, String toolName, Object result) {
        return new ToolResult(toolCallId, toolName, result, true);
    }
}
