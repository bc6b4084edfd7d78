package io.cadence.core;

import io.cadence.api.TransportConstants;
import java.time.Clock;
import java.time.Duration;

/**
 * Construction-time settings for a PlaybackEngine.
 *
 * Built once via builder(). Defaults come from TransportConstants.
 * A null frameScheduler means the engine creates and owns a ScheduledFrameScheduler,
 * and shuts it down on close().
 */
public final class PlaybackEngineConfig {

    /** Every setting at its default. */
    public static final PlaybackEngineConfig DEFAULTS = builder().build();

    private final double initialBpm;
    private final double loopStart;
    private final double loopEnd;
    private final boolean loopEnabled;
    private final Duration smoothJumpSettle;
    private final Duration scrubRelease;
    private final Duration commandTimeout;
    private final double positionEpsilon;
    private final FrameScheduler frameScheduler;
    private final Clock clock;

    private PlaybackEngineConfig(Builder b) {
        this.initialBpm = b.initialBpm;
        this.loopStart = b.loopStart;
        this.loopEnd = b.loopEnd;
        this.loopEnabled = b.loopEnabled;
        this.smoothJumpSettle = b.smoothJumpSettle;
        this.scrubRelease = b.scrubRelease;
        this.commandTimeout = b.commandTimeout;
        this.positionEpsilon = b.positionEpsilon;
        this.frameScheduler = b.frameScheduler;
        this.clock = b.clock;
    }

    public double initialBpm() { return initialBpm; }
    public double loopStart() { return loopStart; }
    public double loopEnd() { return loopEnd; }
    public boolean loopEnabled() { return loopEnabled; }

    /** Wait between audio engine pause and restart in a smooth jump. */
    public Duration smoothJumpSettle() { return smoothJumpSettle; }

    /** Time after a jump before the scrubbing flag is released. */
    public Duration scrubRelease() { return scrubRelease; }

    /** Longest wait for a single audio engine call before it is treated as failed. */
    public Duration commandTimeout() { return commandTimeout; }

    public double positionEpsilon() { return positionEpsilon; }

    /** May be null; see class docs. */
    public FrameScheduler frameScheduler() { return frameScheduler; }

    /** Source of event and state timestamps. */
    public Clock clock() { return clock; }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private double initialBpm = TransportConstants.DEFAULT_BPM;
        private double loopStart = TransportConstants.DEFAULT_LOOP_START;
        private double loopEnd = TransportConstants.DEFAULT_LOOP_END;
        private boolean loopEnabled = true;
        private Duration smoothJumpSettle = Duration.ofMillis(TransportConstants.SMOOTH_JUMP_SETTLE_MS);
        private Duration scrubRelease = Duration.ofMillis(TransportConstants.SCRUB_RELEASE_MS);
        private Duration commandTimeout = Duration.ofMillis(TransportConstants.COMMAND_TIMEOUT_MS);
        private double positionEpsilon = TransportConstants.POSITION_EPSILON;
        private FrameScheduler frameScheduler = null;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        /** Clamped to [MIN_BPM, MAX_BPM] at build time. */
        public Builder initialBpm(double bpm) { this.initialBpm = bpm; return this; }

        public Builder loopStart(double start) { this.loopStart = start; return this; }
        public Builder loopEnd(double end) { this.loopEnd = end; return this; }
        public Builder loopEnabled(boolean enabled) { this.loopEnabled = enabled; return this; }

        public Builder smoothJumpSettle(Duration settle) {
            this.smoothJumpSettle = requireNonNegative(settle, "smoothJumpSettle");
            return this;
        }

        public Builder scrubRelease(Duration release) {
            this.scrubRelease = requireNonNegative(release, "scrubRelease");
            return this;
        }

        /** Must be positive. */
        public Builder commandTimeout(Duration timeout) {
            requireNonNegative(timeout, "commandTimeout");
            if (timeout.isZero()) {
                throw new IllegalArgumentException("commandTimeout must be positive");
            }
            this.commandTimeout = timeout;
            return this;
        }

        public Builder positionEpsilon(double epsilon) {
            if (!(epsilon >= 0.0)) {
                throw new IllegalArgumentException("positionEpsilon must be >= 0: " + epsilon);
            }
            this.positionEpsilon = epsilon;
            return this;
        }

        public Builder frameScheduler(FrameScheduler scheduler) {
            this.frameScheduler = scheduler;
            return this;
        }

        public Builder clock(Clock clock) {
            if (clock == null) {
                throw new NullPointerException("clock");
            }
            this.clock = clock;
            return this;
        }

        public PlaybackEngineConfig build() {
            if (Double.isNaN(initialBpm)) {
                throw new IllegalArgumentException("initialBpm must not be NaN");
            }
            initialBpm = Math.max(TransportConstants.MIN_BPM,
                Math.min(TransportConstants.MAX_BPM, initialBpm));
            return new PlaybackEngineConfig(this);
        }

        private static Duration requireNonNegative(Duration d, String name) {
            if (d == null) {
                throw new NullPointerException(name);
            }
            if (d.isNegative()) {
                throw new IllegalArgumentException(name + " must not be negative: " + d);
            }
            return d;
        }
    }
}
