package io.cadence.api;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Immutable snapshot of the transport.
 *
 * The playback engine owns exactly one current snapshot and replaces it on
 * every mutation. Subscribers and callers of getState() receive the snapshot
 * itself; there is no live alias to mutate.
 *
 * INVARIANTS (enforced by the builder):
 *   isPlaying() == (playbackState() == PLAYING)   - derived, never stored
 *   currentPosition() >= 0                       - negative input clamped
 *   loopStart() >= 0, loopEnd() > loopStart()     - repaired to loopStart + 1
 */
public final class TransportState {

    private final PlaybackState playbackState;
    private final double currentPosition;
    private final double bpm;
    private final boolean loopEnabled;
    private final double loopStart;
    private final double loopEnd;
    private final boolean userScrubbing;
    private final Double ghostPosition;
    private final long lastUpdateTime;
    private final long lastStopTime;

    private TransportState(Builder b) {
        this.playbackState = b.playbackState;
        this.currentPosition = Math.max(0.0, b.currentPosition);
        this.bpm = b.bpm;
        this.loopEnabled = b.loopEnabled;
        this.loopStart = Math.max(0.0, b.loopStart);
        this.loopEnd = Math.max(this.loopStart + 1.0, b.loopEnd);
        this.userScrubbing = b.userScrubbing;
        this.ghostPosition = b.ghostPosition;
        this.lastUpdateTime = b.lastUpdateTime;
        this.lastStopTime = b.lastStopTime;
    }

    /** Stopped at step 0 with the given tempo and loop settings. */
    public static TransportState initial(double bpm, double loopStart, double loopEnd,
                                         boolean loopEnabled) {
        return builder()
            .bpm(bpm)
            .loopStart(loopStart)
            .loopEnd(loopEnd)
            .loopEnabled(loopEnabled)
            .build();
    }

    public boolean isPlaying() { return playbackState == PlaybackState.PLAYING; }
    public PlaybackState playbackState() { return playbackState; }

    /** Committed playhead position in steps. */
    public double currentPosition() { return currentPosition; }

    public double bpm() { return bpm; }
    public boolean loopEnabled() { return loopEnabled; }
    public double loopStart() { return loopStart; }
    public double loopEnd() { return loopEnd; }

    /** True while the UI owns the displayed playhead (drag or jump in progress). */
    public boolean isUserScrubbing() { return userScrubbing; }

    /** UI-only preview playhead. Empty when no preview is shown. */
    public OptionalDouble ghostPosition() {
        return ghostPosition == null ? OptionalDouble.empty() : OptionalDouble.of(ghostPosition);
    }

    /** Epoch ms of the last tracked position change. 0 if none. */
    public long lastUpdateTime() { return lastUpdateTime; }

    /** Epoch ms of the last stop(). 0 if never stopped. */
    public long lastStopTime() { return lastStopTime; }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.playbackState = playbackState;
        b.currentPosition = currentPosition;
        b.bpm = bpm;
        b.loopEnabled = loopEnabled;
        b.loopStart = loopStart;
        b.loopEnd = loopEnd;
        b.userScrubbing = userScrubbing;
        b.ghostPosition = ghostPosition;
        b.lastUpdateTime = lastUpdateTime;
        b.lastStopTime = lastStopTime;
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransportState other)) return false;
        return playbackState == other.playbackState
            && Double.compare(currentPosition, other.currentPosition) == 0
            && Double.compare(bpm, other.bpm) == 0
            && loopEnabled == other.loopEnabled
            && Double.compare(loopStart, other.loopStart) == 0
            && Double.compare(loopEnd, other.loopEnd) == 0
            && userScrubbing == other.userScrubbing
            && Objects.equals(ghostPosition, other.ghostPosition)
            && lastUpdateTime == other.lastUpdateTime
            && lastStopTime == other.lastStopTime;
    }

    @Override
    public int hashCode() {
        return Objects.hash(playbackState, currentPosition, bpm, loopEnabled, loopStart,
            loopEnd, userScrubbing, ghostPosition, lastUpdateTime, lastStopTime);
    }

    @Override
    public String toString() {
        return "TransportState{" + playbackState +
            ", position=" + currentPosition +
            ", bpm=" + bpm +
            ", loop=" + (loopEnabled ? "on" : "off") + "[" + loopStart + ".." + loopEnd + "]" +
            (userScrubbing ? ", scrubbing" : "") +
            (ghostPosition != null ? ", ghost=" + ghostPosition : "") + "}";
    }

    // -- Builder --------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private PlaybackState playbackState = PlaybackState.STOPPED;
        private double currentPosition = 0.0;
        private double bpm = TransportConstants.DEFAULT_BPM;
        private boolean loopEnabled = true;
        private double loopStart = TransportConstants.DEFAULT_LOOP_START;
        private double loopEnd = TransportConstants.DEFAULT_LOOP_END;
        private boolean userScrubbing = false;
        private Double ghostPosition = null;
        private long lastUpdateTime = 0L;
        private long lastStopTime = 0L;

        private Builder() {}

        public Builder playbackState(PlaybackState state) {
            this.playbackState = Objects.requireNonNull(state, "playbackState");
            return this;
        }

        public Builder currentPosition(double position) { this.currentPosition = position; return this; }
        public Builder bpm(double bpm) { this.bpm = bpm; return this; }
        public Builder loopEnabled(boolean enabled) { this.loopEnabled = enabled; return this; }
        public Builder loopStart(double start) { this.loopStart = start; return this; }
        public Builder loopEnd(double end) { this.loopEnd = end; return this; }
        public Builder userScrubbing(boolean scrubbing) { this.userScrubbing = scrubbing; return this; }
        public Builder ghostPosition(double position) { this.ghostPosition = position; return this; }
        public Builder clearGhostPosition() { this.ghostPosition = null; return this; }
        public Builder lastUpdateTime(long epochMs) { this.lastUpdateTime = epochMs; return this; }
        public Builder lastStopTime(long epochMs) { this.lastStopTime = epochMs; return this; }

        public TransportState build() {
            return new TransportState(this);
        }
    }
}
