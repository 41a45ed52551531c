package dev.opscrew.domain.system.toolloop;

/**
 * Why an agent loop run ended.
 */
public enum StopReason {
    /** The model answered without requesting any capability. */
    COMPLETED,
    /** The iteration budget was used up; soft cutoff, not an error. */
    ITERATION_CAP,
    /** The model stream failed; an error event has been emitted. */
    MODEL_ERROR,
    /** The consumer went away. */
    CANCELLED
}
