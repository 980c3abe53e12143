package uk.gegc.aimeter.features.ai.application.relay;

/**
 * Lifecycle of a relay pump: {@code RUNNING -> {SUCCEEDED, FAILED, ABORTED} -> CLOSED}.
 * The pump reaches {@code CLOSED} only after the provider stream is fully drained.
 */
public enum PumpState {
    RUNNING,
    SUCCEEDED,
    FAILED,
    ABORTED,
    CLOSED
}
