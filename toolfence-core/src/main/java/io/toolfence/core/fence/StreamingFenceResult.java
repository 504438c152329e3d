package io.toolfence.core.fence;

/**
 * Result of one incremental detection step. {@code prefixText} is prose that can be shown right
 * away; {@code completeFence} is set only on the step that sees the closer.
 */
public record StreamingFenceResult(String prefixText, String completeFence) {

    public boolean hasFence() {
        return completeFence != null;
    }
}
