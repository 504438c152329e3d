package io.toolfence.core.prompt;

public record PromptOptions(boolean allowParallelToolCalls) {

    public static PromptOptions defaults() {
        return new PromptOptions(false);
    }
}
