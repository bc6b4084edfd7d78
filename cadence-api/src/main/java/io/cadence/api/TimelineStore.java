package io.cadence.api;

import java.util.List;
import java.util.Optional;

/**
 * Read-side seam onto the timeline document: tempo and meter changes,
 * markers and display settings.
 *
 * The transport never edits the timeline. It reads region snapshots and
 * caches derived maps, using generation() to detect that the cache is stale.
 *
 * REGION CONTRACT:
 *   tempoRegions() and timeSignatureRegions() each return a non-empty list,
 *   sorted ascending, contiguous, starting at step 0, with an unbounded last
 *   region. The lists are snapshots; later edits do not mutate them.
 */
public interface TimelineStore {

    /** Tempo regions covering [0, +inf). Never empty. */
    List<TempoRegion> tempoRegions();

    /** Time-signature regions covering [0, +inf). Never empty. */
    List<TimeSignatureRegion> timeSignatureRegions();

    /** Tempo in effect at the given step. */
    double tempoAt(double step);

    /** Meter in effect at the given step. */
    TimeSignature timeSignatureAt(double step);

    /**
     * Returns the marker closest to step whose distance is strictly below threshold.
     * Empty if no marker is close enough.
     */
    Optional<Marker> nearestMarker(double step, double threshold);

    /** Current display settings. Never null. */
    DisplaySettings displaySettings();

    /**
     * Monotonically increasing counter, incremented on every edit.
     * Consumers that cache derived state compare against this to detect staleness.
     */
    long generation();
}
