package io.toolfence.core.fence;

/**
 * Result of one batch detection pass.
 *
 * @param prefixText prose released from the buffer ahead of the fence, or ahead of the retained tail
 * @param fence the full fenced block including delimiters, or {@code null}
 * @param remainingText text after the closer; it stays buffered and is released by later calls
 */
public record FenceDetection(String prefixText, String fence, String remainingText) {

    static FenceDetection noFence(String prefixText) {
        return new FenceDetection(prefixText, null, "");
    }

    public boolean hasFence() {
        return fence != null;
    }
}
