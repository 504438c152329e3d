package io.toolfence.core.agent;

import io.toolfence.core.model.ChatMessage;
import java.util.List;

public record LoopResult(String content, List<ChatMessage> transcript) {

    public LoopResult {
        content = content == null ? "" : content;
        transcript = transcript == null ? List.of() : List.copyOf(transcript);
    }
}
