package io.toolfence.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LoopConfig(
    String model,
    @JsonAlias({"system_prompt"}) String systemPrompt,
    @JsonAlias({"max_tool_iterations"}) int maxToolIterations,
    String workspace
) {

    public static LoopConfig defaults() {
        return new LoopConfig(
            "gpt-4o-mini",
            "",
            10,
            "~/.toolfence/workspace"
        );
    }
}
