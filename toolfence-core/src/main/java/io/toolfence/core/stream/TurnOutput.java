package io.toolfence.core.stream;

import io.toolfence.core.model.ParsedToolCall;
import java.util.List;

public record TurnOutput(String text, List<ParsedToolCall> toolCalls, String rawText) {

    public TurnOutput {
        text = text == null ? "" : text;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        rawText = rawText == null ? "" : rawText;
    }
}
