package io.toolfence.core.fence;

/**
 * Separates prose from fenced payloads in a chunked model stream.
 *
 * <p>One instance serves exactly one streamed turn. Every detection step is computed from the
 * current state and buffer alone, then applied; nothing is shared with other detectors. Text
 * released as prose plus text released as fences, in emission order, followed by a final
 * {@link #flush()}, always equals the concatenation of the chunks.
 *
 * <p>The detector never closes a fence on its own: when the stream ends in {@link
 * DetectorState#IN_FENCE} the caller flushes the buffer and treats it as trailing prose.
 */
public final class StreamingFenceDetector {
    private final FenceScanner scanner;
    private final StringBuilder buffer = new StringBuilder();
    private DetectorState state = DetectorState.SCANNING;

    public StreamingFenceDetector() {
        this(FenceTag.TOOL_CALL);
    }

    public StreamingFenceDetector(FenceTag tag) {
        this.scanner = FenceScanner.forTag(tag);
    }

    public void addChunk(String chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return;
        }
        buffer.append(chunk);
    }

    /**
     * Looks for the first complete fence in the buffer.
     *
     * <p>When one is found, the prose before it and the fence itself leave the buffer; whatever
     * follows the closer stays buffered. Otherwise all text that cannot be part of an opener is
     * released and only the undecided tail (or the open fence) is kept.
     */
    public FenceDetection detectFence() {
        Step step = apply(scanForFence(buffer.toString()));
        if (step.fence() == null) {
            return FenceDetection.noFence(step.prefixText());
        }
        return new FenceDetection(step.prefixText(), step.fence(), buffer.toString());
    }

    /**
     * Advances the incremental state machine by one step.
     *
     * <p>While scanning, releases safe prose and switches to {@link DetectorState#IN_FENCE} once an
     * opener is buffered. While in a fence, returns the complete fence as soon as its closer has
     * arrived and switches back to scanning.
     */
    public StreamingFenceResult detectStreamingFence() {
        String text = buffer.toString();
        Step step = state == DetectorState.SCANNING ? scanForOpener(text) : scanForCloser(text);
        apply(step);
        return new StreamingFenceResult(step.prefixText(), step.fence());
    }

    /**
     * Releases the whole buffer and returns to {@link DetectorState#SCANNING}.
     */
    public String flush() {
        String remaining = buffer.toString();
        buffer.setLength(0);
        state = DetectorState.SCANNING;
        return remaining;
    }

    public boolean hasContent() {
        return buffer.length() > 0;
    }

    public int getBufferSize() {
        return buffer.length();
    }

    public String getBuffer() {
        return buffer.toString();
    }

    public DetectorState getState() {
        return state;
    }

    public boolean isInFence() {
        return state == DetectorState.IN_FENCE;
    }

    public void clearBuffer() {
        buffer.setLength(0);
    }

    public void resetStreamingState() {
        state = DetectorState.SCANNING;
    }

    private Step scanForFence(String text) {
        FenceScanner.Opener opener = scanner.findOpener(text, 0);
        if (opener == null) {
            return releaseUpToPartialOpener(text);
        }
        int closer = scanner.findCloser(text, opener.end());
        if (closer < 0) {
            return new Step(DetectorState.IN_FENCE, opener.start(), text.substring(0, opener.start()), null);
        }
        int end = closer + FenceScanner.FENCE.length();
        return new Step(
            DetectorState.SCANNING,
            end,
            text.substring(0, opener.start()),
            text.substring(opener.start(), end)
        );
    }

    private Step scanForOpener(String text) {
        FenceScanner.Opener opener = scanner.findOpener(text, 0);
        if (opener == null) {
            return releaseUpToPartialOpener(text);
        }
        return new Step(DetectorState.IN_FENCE, opener.start(), text.substring(0, opener.start()), null);
    }

    private Step scanForCloser(String text) {
        // buffer may have been cleared mid-fence, in which case the body starts at 0
        int bodyStart = Math.max(0, scanner.openerEndAt(text, 0));
        int closer = scanner.findCloser(text, bodyStart);
        if (closer < 0) {
            return new Step(DetectorState.IN_FENCE, 0, "", null);
        }
        int end = closer + FenceScanner.FENCE.length();
        return new Step(DetectorState.SCANNING, end, "", text.substring(0, end));
    }

    private Step releaseUpToPartialOpener(String text) {
        int keepFrom = scanner.partialOpenerStart(text);
        return new Step(DetectorState.SCANNING, keepFrom, text.substring(0, keepFrom), null);
    }

    private Step apply(Step step) {
        buffer.delete(0, step.consumed());
        state = step.next();
        return step;
    }

    private record Step(DetectorState next, int consumed, String prefixText, String fence) {
    }
}
