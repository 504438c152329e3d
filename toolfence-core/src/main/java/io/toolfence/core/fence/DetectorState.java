package io.toolfence.core.fence;

public enum DetectorState {
    SCANNING,
    IN_FENCE
}
