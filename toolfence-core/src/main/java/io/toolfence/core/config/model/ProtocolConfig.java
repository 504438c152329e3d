package io.toolfence.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.toolfence.core.parse.ToolCallGrammar;
import io.toolfence.core.prompt.PromptOptions;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProtocolConfig(
    ToolCallGrammar grammar,
    @JsonAlias({"allow_parallel_tool_calls"}) boolean allowParallelToolCalls
) {

    public ProtocolConfig {
        grammar = grammar == null ? ToolCallGrammar.JSON : grammar;
    }

    public static ProtocolConfig defaults() {
        return new ProtocolConfig(ToolCallGrammar.JSON, false);
    }

    public PromptOptions promptOptions() {
        return new PromptOptions(allowParallelToolCalls);
    }
}
