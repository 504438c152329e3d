package io.toolfence.core.format;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolfence.core.fence.FenceScanner;
import io.toolfence.core.fence.FenceTag;
import io.toolfence.core.model.ToolResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolResultFormatterTest {
    private final ToolResultFormatter formatter = new ToolResultFormatter();

    @Test
    void shouldFormatSingleResultAsCompactLine() {
        String fence = formatter.format(List.of(ToolResult.success("1", "t", Map.of("x", 1))));

        assertThat(fence).isEqualTo("```tool_result\n{\"id\":\"1\",\"name\":\"t\",\"result\":{\"x\":1},\"error\":false}\n```");
    }

    @Test
    void shouldReturnEmptyStringForNoResults() {
        assertThat(formatter.format(List.of())).isEmpty();
        assertThat(formatter.format(null)).isEmpty();
        assertThat(formatter.formatSingle(null)).isEmpty();
    }

    @Test
    void shouldOmitMissingIdAndWriteNullResult() {
        String line = formatter.toLine(new ToolResult(null, "t", null, true));

        assertThat(line).isEqualTo("{\"name\":\"t\",\"result\":null,\"error\":true}");
    }

    @Test
    void shouldFallBackToStringFormForUnserializableResult() {
        String line = formatter.toLine(ToolResult.success("1", "t", new Object()));

        assertThat(line).contains("\"result\":\"java.lang.Object@");
    }

    @Test
    void shouldExtractExactlyTheSerializedLines() throws Exception {
        List<ToolResult> results = List.of(
            ToolResult.success("a1", "read", "line one\nline two"),
            ToolResult.error("a2", "write", "Error executing tool 'write': denied"),
            new ToolResult(null, "list", List.of("a.txt", "b.txt"), false)
        );
        String fence = formatter.format(results);

        assertThat(FenceScanner.forTag(FenceTag.TOOL_RESULT).extractBlock("Tool output:\n" + fence + "\nthanks"))
            .isEqualTo(fence);

        List<String> lines = ToolResultFormatter.extractLines("Tool output:\n" + fence + "\nthanks");
        List<String> expected = new ArrayList<>();
        for (ToolResult result : results) {
            expected.add(formatter.toLine(result));
        }
        assertThat(lines).isEqualTo(expected);

        ObjectMapper mapper = new ObjectMapper();
        JsonNode first = mapper.readTree(lines.get(0));
        assertThat(first.path("result").asText()).isEqualTo("line one\nline two");
        assertThat(mapper.readTree(lines.get(1)).path("error").asBoolean()).isTrue();
        assertThat(mapper.readTree(lines.get(2)).has("id")).isFalse();
    }

    @Test
    void shouldExtractNothingWithoutResultFence() {
        assertThat(ToolResultFormatter.extractLines(null)).isEmpty();
        assertThat(ToolResultFormatter.extractLines("```tool_call\n{\"name\":\"a\"}\n```")).isEmpty();
        assertThat(ToolResultFormatter.extractLines("```tool_result\n{\"name\":\"a\"}")).isEmpty();
    }
}
