package io.toolfence.core.transcript;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.toolfence.core.model.ChatMessage;
import io.toolfence.core.model.MessageRole;
import io.toolfence.core.model.ParsedToolCall;
import io.toolfence.core.model.TextMessage;
import io.toolfence.core.model.ToolResult;
import java.util.List;
import org.junit.jupiter.api.Test;

class TranscriptRendererTest {
    private final TranscriptRenderer renderer = new TranscriptRenderer();
    private final ParsedToolCall call = new ParsedToolCall("c1", "read", JsonNodeFactory.instance.objectNode());

    @Test
    void shouldFlattenToolTurnsIntoPlainMessages() {
        RenderedTranscript rendered = renderer.render(List.of(
            ChatMessage.system("A"),
            ChatMessage.system("B"),
            ChatMessage.user("hi"),
            ChatMessage.assistantWithToolCalls("Let me check", List.of(call)),
            ChatMessage.tool(List.of(ToolResult.success("c1", "read", "one"))),
            ChatMessage.tool(List.of(ToolResult.error("c2", "write", "denied"))),
            ChatMessage.assistant("done")
        ));

        assertThat(rendered.systemPrompt()).isEqualTo("A\n\nB");
        assertThat(rendered.messages()).extracting(TextMessage::role)
            .containsExactly(MessageRole.USER, MessageRole.ASSISTANT, MessageRole.USER, MessageRole.ASSISTANT);
        assertThat(rendered.messages().get(1).content())
            .isEqualTo("Let me check\n```tool_call\n{\"name\":\"read\",\"arguments\":{},\"id\":\"c1\"}\n```");
        assertThat(rendered.messages().get(2).content()).isEqualTo(
            "```tool_result\n"
                + "{\"id\":\"c1\",\"name\":\"read\",\"result\":\"one\",\"error\":false}\n"
                + "{\"id\":\"c2\",\"name\":\"write\",\"result\":\"denied\",\"error\":true}\n"
                + "```"
        );
    }

    @Test
    void shouldOmitBlankAssistantTextBeforeCallFence() {
        RenderedTranscript rendered = renderer.render(List.of(
            ChatMessage.user("hi"),
            ChatMessage.assistantWithToolCalls("  ", List.of(call))
        ));

        assertThat(rendered.messages().get(1).content()).startsWith("```tool_call\n");
        assertThat(rendered.systemPrompt()).isEmpty();
    }

    @Test
    void shouldRenderEmptyHistory() {
        RenderedTranscript rendered = renderer.render(null);

        assertThat(rendered.systemPrompt()).isEmpty();
        assertThat(rendered.messages()).isEmpty();
    }
}
