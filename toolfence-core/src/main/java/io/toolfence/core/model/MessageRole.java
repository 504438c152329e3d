package io.toolfence.core.model;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT,
    TOOL
}
