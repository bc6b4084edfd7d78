package io.cadence.api;

/**
 * Run states of the transport.
 *
 * Valid transitions:
 *   STOPPED -> PLAYING   (play)
 *   PAUSED  -> PLAYING   (play / toggle)
 *   PLAYING -> PAUSED    (pause / toggle)
 *   any     -> STOPPED   (stop; playhead re-homed)
 *
 * No terminal state - the transport lives as long as its owner.
 */
public enum PlaybackState {

    /** Not running. Playhead at loop start or zero after stop(). */
    STOPPED,

    /** Running. Position tracked from the audio engine clock every frame. */
    PLAYING,

    /** Not running. Playhead kept at the last sampled position. */
    PAUSED
}
