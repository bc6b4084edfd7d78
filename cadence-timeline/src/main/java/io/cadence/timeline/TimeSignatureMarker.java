package io.cadence.timeline;

import io.cadence.api.TimeSignature;

/**
 * A meter change: from position onward bars follow timeSignature,
 * until the next time signature marker.
 */
public record TimeSignatureMarker(String id, double position, TimeSignature timeSignature) {

    public TimeSignatureMarker {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("TimeSignatureMarker id must not be blank");
        }
        if (!(position >= 0.0) || Double.isInfinite(position)) {
            throw new IllegalArgumentException(
                "TimeSignatureMarker position must be finite and >= 0: " + position);
        }
        if (timeSignature == null) {
            throw new NullPointerException("timeSignature");
        }
    }
}
