package io.cadence.api;

import java.util.OptionalDouble;

/**
 * Sealed hierarchy for events published by the playback engine.
 *
 * Every event is an envelope {type, payload, timestamp}. Events are delivered
 * synchronously on the thread that caused them: a UI command thread, an audio
 * engine completion thread, or the frame scheduler thread.
 */
public sealed interface TransportEvent
    permits TransportEvent.StateChanged,
            TransportEvent.PositionUpdate,
            TransportEvent.GhostPositionChanged {

    /** Envelope discriminator. */
    TransportEventType type();

    /** Wall-clock time of publication, in epoch milliseconds. */
    long timestampMs();

    /**
     * The transport state changed, or a subscriber asked for the present state.
     * The snapshot is immutable and safe to keep.
     */
    record StateChanged(
        TransportState state,
        StateChangeReason reason,
        long timestampMs
    ) implements TransportEvent {
        @Override
        public TransportEventType type() { return TransportEventType.STATE_CHANGE; }
    }

    /**
     * The committed playhead moved: tracked from the audio clock, jumped, or re-homed by stop.
     */
    record PositionUpdate(
        double position,
        long timestampMs
    ) implements TransportEvent {
        @Override
        public TransportEventType type() { return TransportEventType.POSITION_UPDATE; }
    }

    /**
     * The ghost (preview) playhead was set or cleared. Empty position = cleared.
     */
    record GhostPositionChanged(
        OptionalDouble position,
        long timestampMs
    ) implements TransportEvent {
        @Override
        public TransportEventType type() { return TransportEventType.GHOST_POSITION_CHANGE; }
    }
}
