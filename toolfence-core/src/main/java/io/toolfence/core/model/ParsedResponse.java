package io.toolfence.core.model;

import java.util.List;

public record ParsedResponse(List<ParsedToolCall> toolCalls, String textContent) {

    public ParsedResponse {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        textContent = textContent == null ? "" : textContent;
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
