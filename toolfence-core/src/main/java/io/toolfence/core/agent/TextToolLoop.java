package io.toolfence.core.agent;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolfence.core.model.ChatMessage;
import io.toolfence.core.model.ParsedToolCall;
import io.toolfence.core.model.ToolResult;
import io.toolfence.core.parse.ToolCallParser;
import io.toolfence.core.prompt.SystemPromptBuilder;
import io.toolfence.core.provider.TextModel;
import io.toolfence.core.stream.FenceStreamProcessor;
import io.toolfence.core.stream.StreamListener;
import io.toolfence.core.stream.TurnOutput;
import io.toolfence.core.tool.Tool;
import io.toolfence.core.tool.ToolContext;
import io.toolfence.core.tool.ToolRegistry;
import io.toolfence.core.transcript.RenderedTranscript;
import io.toolfence.core.transcript.TranscriptRenderer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a tool-using conversation against a model that only speaks text. Each turn is rendered to
 * plain messages, streamed through a fence processor, and any recovered calls are executed and fed
 * back as a result fence before the model is asked to continue.
 */
public final class TextToolLoop {
    private static final Logger LOG = LoggerFactory.getLogger(TextToolLoop.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    static final String MAX_ITERATIONS_MESSAGE = "Stopped after max tool iterations";

    private final TextModel model;
    private final ToolRegistry toolRegistry;
    private final ToolCallParser parser;
    private final SystemPromptBuilder promptBuilder;
    private final TranscriptRenderer renderer;

    public TextToolLoop(TextModel model, ToolRegistry toolRegistry, ToolCallParser parser) {
        this(model, toolRegistry, parser, new SystemPromptBuilder(), new TranscriptRenderer());
    }

    public TextToolLoop(
        TextModel model,
        ToolRegistry toolRegistry,
        ToolCallParser parser,
        SystemPromptBuilder promptBuilder,
        TranscriptRenderer renderer
    ) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.toolRegistry = Objects.requireNonNull(toolRegistry, "toolRegistry must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
    }

    public LoopResult run(String userPrompt, LoopSettings settings, Path workspace) {
        return run(userPrompt, settings, workspace, StreamListener.noop());
    }

    public LoopResult run(String userPrompt, LoopSettings settings, Path workspace, StreamListener listener) {
        List<ChatMessage> transcript = new ArrayList<>();
        String systemPrompt = promptBuilder.build(
            settings.systemPrompt(),
            toolRegistry.definitions(),
            settings.promptOptions()
        );
        transcript.add(ChatMessage.system(systemPrompt));
        transcript.add(ChatMessage.user(userPrompt));
        LOG.debug("Using model {} ({}) with {} tools", model.name(), settings.model(), toolRegistry.all().size());

        ToolContext context = new ToolContext(workspace);
        for (int i = 0; i < settings.maxToolIterations(); i++) {
            TurnOutput turn = streamTurn(settings.model(), transcript, listener);
            if (turn.toolCalls().isEmpty()) {
                transcript.add(ChatMessage.assistant(turn.text()));
                return new LoopResult(turn.text(), transcript);
            }

            transcript.add(ChatMessage.assistantWithToolCalls(turn.text(), turn.toolCalls()));
            List<ToolResult> results = new ArrayList<>();
            for (ParsedToolCall call : turn.toolCalls()) {
                results.add(execute(call, context));
            }
            transcript.add(ChatMessage.tool(results));
        }

        transcript.add(ChatMessage.assistant(MAX_ITERATIONS_MESSAGE));
        return new LoopResult(MAX_ITERATIONS_MESSAGE, transcript);
    }

    private TurnOutput streamTurn(String modelName, List<ChatMessage> transcript, StreamListener listener) {
        RenderedTranscript rendered = renderer.render(transcript);
        FenceStreamProcessor processor = new FenceStreamProcessor(parser, listener);
        model.stream(modelName, rendered.systemPrompt(), rendered.messages(), processor);
        return processor.finish();
    }

    private ToolResult execute(ParsedToolCall call, ToolContext context) {
        Tool tool = toolRegistry.find(call.toolName()).orElse(null);
        if (tool == null) {
            return ToolResult.error(call.toolCallId(), call.toolName(), "Tool '" + call.toolName() + "' not found");
        }
        if (!call.args().isObject()) {
            return ToolResult.error(call.toolCallId(), call.toolName(), "Tool arguments must be a JSON object");
        }

        try {
            Map<String, Object> input = JSON.convertValue(call.args(), MAP_TYPE);
            Object output = tool.execute(input, new ToolContext(context.workspace(), call.toolCallId()));
            return ToolResult.success(call.toolCallId(), call.toolName(), output);
        } catch (RuntimeException ex) {
            LOG.warn("Tool {} failed", tool.name(), ex);
            String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            return ToolResult.error(call.toolCallId(), call.toolName(), "Error executing tool '" + tool.name() + "': " + message);
        }
    }
}
