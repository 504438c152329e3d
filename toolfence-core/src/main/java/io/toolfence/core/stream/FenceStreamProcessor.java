package io.toolfence.core.stream;

import io.toolfence.core.fence.FenceDetection;
import io.toolfence.core.fence.StreamingFenceDetector;
import io.toolfence.core.model.ParsedToolCall;
import io.toolfence.core.parse.ToolCallParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Runs one streamed turn through a fresh detector. Prose reaches the listener as soon as it can no
 * longer be part of a fence; calls are reported as each fence closes. Not thread-safe: one
 * instance per turn.
 */
public final class FenceStreamProcessor implements Consumer<String> {
    private final ToolCallParser parser;
    private final StreamListener listener;
    private final StreamingFenceDetector detector = new StreamingFenceDetector();
    private final StringBuilder rawText = new StringBuilder();
    private final StringBuilder prose = new StringBuilder();
    private final List<Segment> segments = new ArrayList<>();
    private boolean cancelled;
    private TurnOutput output;

    public FenceStreamProcessor(ToolCallParser parser) {
        this(parser, StreamListener.noop());
    }

    public FenceStreamProcessor(ToolCallParser parser, StreamListener listener) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.listener = listener == null ? StreamListener.noop() : listener;
    }

    @Override
    public void accept(String chunk) {
        if (cancelled || output != null || chunk == null || chunk.isEmpty()) {
            return;
        }
        rawText.append(chunk);
        detector.addChunk(chunk);
        while (true) {
            FenceDetection detection = detector.detectFence();
            emitText(detection.prefixText());
            if (!detection.hasFence()) {
                return;
            }
            closeProse();
            List<ParsedToolCall> calls = parser.parse(detection.fence()).toolCalls();
            segments.add(new Segment(null, calls));
            calls.forEach(listener::onToolCall);
        }
    }

    /**
     * Stops consuming chunks. Whatever is still buffered is released as text by {@link #finish()}.
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Flushes the detector and returns the turn with its calls in order of appearance. Tag and
     * literal calls are looked up per prose run between fences, so none can straddle a fence;
     * the listener hears about them only now.
     */
    public TurnOutput finish() {
        if (output != null) {
            return output;
        }
        emitText(detector.flush());
        closeProse();

        List<ParsedToolCall> calls = new ArrayList<>();
        for (Segment segment : segments) {
            if (segment.prose() == null) {
                calls.addAll(segment.fencedCalls());
            } else if (parser.grammar().acceptsTagsAndLiterals()) {
                for (ParsedToolCall call : parser.parse(segment.prose()).toolCalls()) {
                    calls.add(call);
                    listener.onToolCall(call);
                }
            }
        }
        String raw = rawText.toString();
        output = new TurnOutput(parser.parse(raw).textContent(), calls, raw);
        return output;
    }

    private void closeProse() {
        if (prose.length() > 0) {
            segments.add(new Segment(prose.toString(), List.of()));
            prose.setLength(0);
        }
    }

    private void emitText(String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        prose.append(text);
        listener.onText(text);
    }

    /**
     * Either a run of prose or the calls of one closed fence.
     */
    private record Segment(String prose, List<ParsedToolCall> fencedCalls) {
    }
}
