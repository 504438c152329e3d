package io.toolfence.core.agent;

import io.toolfence.core.prompt.PromptOptions;

public record LoopSettings(String systemPrompt, String model, int maxToolIterations, PromptOptions promptOptions) {

    public LoopSettings {
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model must not be blank");
        }
        maxToolIterations = Math.max(1, maxToolIterations);
        promptOptions = promptOptions == null ? PromptOptions.defaults() : promptOptions;
    }

    public LoopSettings(String systemPrompt, String model, int maxToolIterations) {
        this(systemPrompt, model, maxToolIterations, PromptOptions.defaults());
    }
}
