package io.cadence.api;

/**
 * Global constants for the Cadence transport.
 *
 * Time model: one step is one sixteenth note at the governing tempo,
 * so a quarter-note beat is STEPS_PER_BEAT steps regardless of the meter.
 * Changing STEPS_PER_BEAT shifts every stored step position - treat it as locked.
 */
public final class TransportConstants {

    private TransportConstants() {}

    // -- Time model -----------------------------------------------------------

    /** Steps per quarter-note beat. LOCKED at 4 (sixteenth-note resolution). */
    public static final int STEPS_PER_BEAT = 4;

    /** Milliseconds in one minute. */
    public static final double MS_PER_MINUTE = 60_000.0;

    /**
     * Default audio engine resolution in pulses per quarter note.
     * One step = DEFAULT_PPQ / STEPS_PER_BEAT ticks.
     */
    public static final int DEFAULT_PPQ = 96;

    // -- Tempo ----------------------------------------------------------------

    /** Lowest BPM the transport accepts. Lower requests are clamped. */
    public static final double MIN_BPM = 60.0;

    /** Highest BPM the transport accepts. Higher requests are clamped. */
    public static final double MAX_BPM = 300.0;

    /** Tempo of a freshly created timeline and transport. */
    public static final double DEFAULT_BPM = 140.0;

    // -- Loop defaults --------------------------------------------------------

    public static final double DEFAULT_LOOP_START = 0.0;

    /** Four bars of 4/4. */
    public static final double DEFAULT_LOOP_END = 64.0;

    // -- Position tracking ----------------------------------------------------

    /**
     * Smallest position change (in steps) the tracker republishes.
     * Smaller deltas are treated as jitter and dropped.
     */
    public static final double POSITION_EPSILON = 0.01;

    /** Frame rate of the default position-tracking scheduler. */
    public static final int POSITION_UPDATE_RATE_HZ = 60;

    /** Pause between audio engine pause and restart during a smooth jump. */
    public static final long SMOOTH_JUMP_SETTLE_MS = 50L;

    /** Time after a jump before the scrubbing flag is released. */
    public static final long SCRUB_RELEASE_MS = 100L;

    /**
     * Longest wait for one audio engine call. A call that has not completed by
     * then counts as failed, so later transport commands are not held up by it.
     */
    public static final long COMMAND_TIMEOUT_MS = 2_000L;

    // -- Rendering / snapping -------------------------------------------------

    /** Width of one step in pixels at zoom 1.0. */
    public static final double DEFAULT_BASE_STEP_WIDTH = 10.0;

    /** Distance in steps within which snapToMarker() attracts a position. */
    public static final double DEFAULT_MARKER_SNAP_THRESHOLD = 4.0;

    // -- Validation -----------------------------------------------------------

    /**
     * Verifies internal consistency of the constants.
     * Throws IllegalStateException if any invariant is violated.
     */
    public static void validate() {
        if (MIN_BPM <= 0.0 || MAX_BPM <= MIN_BPM) {
            throw new IllegalStateException(
                "BPM range must be positive and non-empty; actual = [" +
                MIN_BPM + ".." + MAX_BPM + "]");
        }
        if (DEFAULT_BPM < MIN_BPM || DEFAULT_BPM > MAX_BPM) {
            throw new IllegalStateException(
                "DEFAULT_BPM " + DEFAULT_BPM + " outside [" + MIN_BPM + ".." + MAX_BPM + "]");
        }
        if (DEFAULT_LOOP_END <= DEFAULT_LOOP_START) {
            throw new IllegalStateException("DEFAULT_LOOP_END must be > DEFAULT_LOOP_START");
        }
        if (DEFAULT_PPQ % STEPS_PER_BEAT != 0) {
            throw new IllegalStateException(
                "DEFAULT_PPQ must be a multiple of STEPS_PER_BEAT; actual = " + DEFAULT_PPQ);
        }
        if (POSITION_UPDATE_RATE_HZ <= 0) {
            throw new IllegalStateException("POSITION_UPDATE_RATE_HZ must be positive");
        }
        if (COMMAND_TIMEOUT_MS <= SMOOTH_JUMP_SETTLE_MS) {
            throw new IllegalStateException(
                "COMMAND_TIMEOUT_MS must exceed SMOOTH_JUMP_SETTLE_MS; actual = " + COMMAND_TIMEOUT_MS);
        }
    }

    static {
        validate();
    }
}
