package io.cadence.api;

/**
 * Why a state-change event was published.
 */
public enum StateChangeReason {
    /** Replay of the current state to a newly registered subscriber. */
    SUBSCRIPTION,
    PLAY_COMMAND,
    PAUSE_COMMAND,
    STOP_COMMAND,
    /** The UI took over the displayed playhead. */
    SCRUB_START,
    /** The UI released the displayed playhead. */
    SCRUB_END,
    BPM_CHANGE,
    /** Loop range or loop enable flag changed. */
    LOOP_CHANGE
}
