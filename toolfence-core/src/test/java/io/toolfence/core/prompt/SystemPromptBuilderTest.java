package io.toolfence.core.prompt;

import static org.assertj.core.api.Assertions.assertThat;

import io.toolfence.core.model.ToolDefinition;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SystemPromptBuilderTest {
    private final SystemPromptBuilder builder = new SystemPromptBuilder();
    private final ToolDefinition weather = new ToolDefinition(
        "get_weather",
        "Look up the weather",
        Map.of("type", "object", "properties", Map.of("city", Map.of("type", "string")))
    );

    @Test
    void shouldReturnPriorPromptWhenNoToolsAreGiven() {
        assertThat(builder.build(null, List.of())).isEmpty();
        assertThat(builder.build("Original", List.of())).isEqualTo("Original");
        assertThat(builder.build("  spaced  ", null)).isEqualTo("  spaced  ");
    }

    @Test
    void shouldCollapseBlankPriorPromptToEmptyWhenNoToolsAreGiven() {
        assertThat(builder.build("   ", List.of())).isEmpty();
        assertThat(builder.build("\n\t ", null)).isEmpty();
    }

    @Test
    void shouldPrefixTrimmedPriorPrompt() {
        String prompt = builder.build("  Be concise.  ", List.of(weather));

        assertThat(prompt).startsWith("Be concise.\n\n" + SystemPromptBuilder.PREAMBLE);
    }

    @Test
    void shouldStartWithPreambleWhenPriorPromptIsBlank() {
        assertThat(builder.build("   ", List.of(weather))).startsWith(SystemPromptBuilder.PREAMBLE);
        assertThat(builder.build(null, List.of(weather))).startsWith(SystemPromptBuilder.PREAMBLE);
    }

    @Test
    void shouldDescribeToolsAndProtocol() {
        String prompt = builder.build(null, List.of(weather));

        assertThat(prompt)
            .contains("# Available Tools")
            .contains("\"get_weather\"")
            .contains("\"parameters\"")
            .contains("# Tool Calling Instructions")
            .contains("Only request one tool call at a time.")
            .contains("```tool_call\n{\"name\": \"tool_name\"")
            .contains("```tool_result\n{\"id\": \"call_123\"")
            .doesNotContain("For multiple parallel calls:")
            .endsWith("- If no tool is needed, respond directly without tool_call fences");
    }

    @Test
    void shouldFillMissingDescriptionAndSchema() {
        String prompt = builder.build(null, List.of(ToolDefinition.of("ping", null)));

        assertThat(prompt).contains(SystemPromptBuilder.MISSING_DESCRIPTION).contains("\"properties\"");
        assertThat(prompt.indexOf("\"type\" : \"object\"")).isLessThan(prompt.indexOf("\"properties\""));
    }

    @Test
    void shouldExplainParallelCallsWhenAllowed() {
        String prompt = builder.build(null, List.of(weather), new PromptOptions(true));

        assertThat(prompt)
            .contains("You may return multiple tool calls in the array")
            .contains("For multiple parallel calls:")
            .doesNotContain("Only request one tool call at a time.");
    }
}
