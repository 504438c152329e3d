package io.toolfence.core.transcript;

import io.toolfence.core.format.ToolCallFormatter;
import io.toolfence.core.format.ToolResultFormatter;
import io.toolfence.core.model.ChatMessage;
import io.toolfence.core.model.MessageRole;
import io.toolfence.core.model.TextMessage;
import io.toolfence.core.model.ToolResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Flattens a structured history into the plain messages a text-only backend accepts. Calls are
 * rendered as a call fence after the assistant text and runs of tool messages collapse into one
 * user message carrying a result fence.
 */
public final class TranscriptRenderer {
    private final ToolCallFormatter callFormatter;
    private final ToolResultFormatter resultFormatter;

    public TranscriptRenderer() {
        this(new ToolCallFormatter(), new ToolResultFormatter());
    }

    public TranscriptRenderer(ToolCallFormatter callFormatter, ToolResultFormatter resultFormatter) {
        this.callFormatter = Objects.requireNonNull(callFormatter, "callFormatter must not be null");
        this.resultFormatter = Objects.requireNonNull(resultFormatter, "resultFormatter must not be null");
    }

    public RenderedTranscript render(List<ChatMessage> history) {
        List<String> systemParts = new ArrayList<>();
        List<TextMessage> messages = new ArrayList<>();
        List<ToolResult> pendingResults = new ArrayList<>();

        for (ChatMessage message : history == null ? List.<ChatMessage>of() : history) {
            if (message.role() == MessageRole.TOOL) {
                pendingResults.addAll(message.toolResults());
                continue;
            }
            flushResults(pendingResults, messages);
            switch (message.role()) {
                case SYSTEM -> {
                    if (!message.content().isBlank()) {
                        systemParts.add(message.content());
                    }
                }
                case USER -> messages.add(new TextMessage(MessageRole.USER, message.content()));
                case ASSISTANT -> messages.add(new TextMessage(MessageRole.ASSISTANT, renderAssistant(message)));
                default -> throw new IllegalStateException("Unexpected role " + message.role());
            }
        }
        flushResults(pendingResults, messages);
        return new RenderedTranscript(String.join("\n\n", systemParts), messages);
    }

    private String renderAssistant(ChatMessage message) {
        if (message.toolCalls().isEmpty()) {
            return message.content();
        }
        String fence = callFormatter.format(message.toolCalls());
        return message.content().isBlank() ? fence : message.content() + "\n" + fence;
    }

    private void flushResults(List<ToolResult> pending, List<TextMessage> messages) {
        if (pending.isEmpty()) {
            return;
        }
        messages.add(new TextMessage(MessageRole.USER, resultFormatter.format(pending)));
        pending.clear();
    }
}
