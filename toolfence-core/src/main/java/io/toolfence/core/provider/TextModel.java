package io.toolfence.core.provider;

import io.toolfence.core.model.TextMessage;
import java.util.List;
import java.util.function.Consumer;

/**
 * A backend that can only produce text. Output is pushed to {@code chunks} in delivery order and
 * the call returns when the stream ends.
 */
public interface TextModel {
    String name();

    void stream(String model, String systemPrompt, List<TextMessage> messages, Consumer<String> chunks);
}
