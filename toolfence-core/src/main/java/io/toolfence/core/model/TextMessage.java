package io.toolfence.core.model;

import java.util.Objects;

/**
 * A message as seen by a text-only backend: tool calls and results are already folded into
 * {@code content} as fences.
 */
public record TextMessage(MessageRole role, String content) {

    public TextMessage {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
    }
}
