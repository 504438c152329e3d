package io.toolfence.core.format;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import io.toolfence.core.model.ParsedResponse;
import io.toolfence.core.model.ParsedToolCall;
import io.toolfence.core.parse.ToolCallParser;
import java.util.List;
import org.junit.jupiter.api.Test;

class ToolCallFormatterTest {
    private final ToolCallFormatter formatter = new ToolCallFormatter();

    @Test
    void shouldWriteOneCallPerLine() {
        ParsedToolCall call = new ParsedToolCall("c1", "t", JsonNodeFactory.instance.objectNode().put("x", 1));

        assertThat(formatter.format(List.of(call)))
            .isEqualTo("```tool_call\n{\"name\":\"t\",\"arguments\":{\"x\":1},\"id\":\"c1\"}\n```");
    }

    @Test
    void shouldInlineTextualJsonArguments() {
        ParsedToolCall call = new ParsedToolCall("c1", "t", TextNode.valueOf("{\"y\":2}"));

        assertThat(formatter.format(List.of(call))).contains("\"arguments\":{\"y\":2}");
    }

    @Test
    void shouldBeReadBackByParser() {
        List<ParsedToolCall> calls = List.of(
            new ParsedToolCall("c1", "read", JsonNodeFactory.instance.objectNode().put("path", "a.txt")),
            new ParsedToolCall("c2", "list", null)
        );

        ParsedResponse parsed = new ToolCallParser().parse("Working on it.\n" + formatter.format(calls));

        assertThat(parsed.toolCalls()).isEqualTo(calls);
        assertThat(parsed.textContent()).isEqualTo("Working on it.");
    }

    @Test
    void shouldReturnEmptyStringForNoCalls() {
        assertThat(formatter.format(List.of())).isEmpty();
    }
}
