package io.toolfence.core.stream;

import io.toolfence.core.model.ParsedToolCall;

/**
 * Receives the pieces of a turn as soon as they are known.
 */
public interface StreamListener {

    default void onText(String text) {
    }

    default void onToolCall(ParsedToolCall call) {
    }

    static StreamListener noop() {
        return new StreamListener() {
        };
    }
}
