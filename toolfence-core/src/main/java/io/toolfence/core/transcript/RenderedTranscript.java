package io.toolfence.core.transcript;

import io.toolfence.core.model.TextMessage;
import java.util.List;

public record RenderedTranscript(String systemPrompt, List<TextMessage> messages) {

    public RenderedTranscript {
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
