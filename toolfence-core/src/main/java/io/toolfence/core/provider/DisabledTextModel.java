package io.toolfence.core.provider;

import io.toolfence.core.model.TextMessage;
import java.util.List;
import java.util.function.Consumer;

/**
 * Placeholder used when no backend is configured. Streams a single deterministic error line.
 */
public final class DisabledTextModel implements TextModel {
    private final String name;
    private final String reason;

    public DisabledTextModel(String name, String reason) {
        this.name = name;
        this.reason = reason == null || reason.isBlank() ? "model is disabled" : reason;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void stream(String model, String systemPrompt, List<TextMessage> messages, Consumer<String> chunks) {
        chunks.accept("Error calling LLM: model " + name + " is not configured (" + reason + ")");
    }
}
