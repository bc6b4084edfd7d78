package io.cadence.timeline;

/**
 * A tempo change: from position onward the timeline plays at bpm,
 * until the next tempo marker.
 */
public record TempoMarker(String id, double position, double bpm) {

    public TempoMarker {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("TempoMarker id must not be blank");
        }
        if (!(position >= 0.0) || Double.isInfinite(position)) {
            throw new IllegalArgumentException("TempoMarker position must be finite and >= 0: " + position);
        }
        if (!(bpm > 0.0) || Double.isInfinite(bpm)) {
            throw new IllegalArgumentException("TempoMarker bpm must be positive: " + bpm);
        }
    }
}
