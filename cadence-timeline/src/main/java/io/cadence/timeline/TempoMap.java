package io.cadence.timeline;

import io.cadence.api.TempoRegion;
import java.util.Collections;
import java.util.List;

/**
 * Immutable step <-> millisecond mapping over a piecewise-constant tempo timeline.
 *
 * Built once from a region snapshot. Cumulative milliseconds at the start of every
 * region are precomputed, so both directions are a binary search plus one
 * multiply - no walk over earlier regions per call.
 *
 * REGION CONTRACT (validated at construction):
 *   non-empty, first region starts at 0, each region ends where the next starts,
 *   last region unbounded.
 *
 * Negative inputs map to 0 in both directions. stepToMs is strictly increasing
 * over [0, +inf), so msToStep is its exact inverse up to floating-point rounding.
 */
public final class TempoMap {

    private final TempoRegion[] regions;

    /** msAtStart[i] = milliseconds elapsed at regions[i].startStep(). */
    private final double[] msAtStart;

    private final List<TempoRegion> regionView;

    private TempoMap(List<TempoRegion> source) {
        this.regions = source.toArray(new TempoRegion[0]);
        this.msAtStart = new double[regions.length];
        double ms = 0.0;
        for (int i = 0; i < regions.length; i++) {
            msAtStart[i] = ms;
            if (!regions[i].isUnbounded()) {
                ms += regions[i].lengthSteps() * regions[i].msPerStep();
            }
        }
        this.regionView = Collections.unmodifiableList(List.of(regions));
    }

    /**
     * @param regions ordered, contiguous regions covering [0, +inf)
     * @throws IllegalArgumentException if the regions violate the contract
     */
    public static TempoMap of(List<TempoRegion> regions) {
        if (regions == null) {
            throw new NullPointerException("regions");
        }
        validate(regions);
        return new TempoMap(regions);
    }

    /** A single region at the given tempo from 0 to +inf. */
    public static TempoMap constant(double bpm) {
        return of(List.of(new TempoRegion(0.0, Double.POSITIVE_INFINITY, bpm)));
    }

    public List<TempoRegion> regions() { return regionView; }

    // -- Conversions ----------------------------------------------------------

    /** Elapsed milliseconds from step 0 to the given step. */
    public double stepToMs(double step) {
        if (!(step > 0.0)) {
            return 0.0;
        }
        int i = indexAt(step);
        TempoRegion region = regions[i];
        return msAtStart[i] + (step - region.startStep()) * region.msPerStep();
    }

    /** Step reached after the given number of milliseconds from step 0. */
    public double msToStep(double ms) {
        if (!(ms > 0.0)) {
            return 0.0;
        }
        int i = indexAtMs(ms);
        TempoRegion region = regions[i];
        return region.startStep() + (ms - msAtStart[i]) / region.msPerStep();
    }

    /** Tempo in effect at step. Negative steps read the first region. */
    public double tempoAt(double step) {
        return regionAt(step).bpm();
    }

    /** Region containing step. Negative steps read the first region. */
    public TempoRegion regionAt(double step) {
        return regions[indexAt(step)];
    }

    // -- Internal helpers -----------------------------------------------------

    /** Index of the last region whose start is <= step. */
    private int indexAt(double step) {
        int lo = 0;
        int hi = regions.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (regions[mid].startStep() <= step) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo;
    }

    /** Index of the last region whose cumulative start time is <= ms. */
    private int indexAtMs(double ms) {
        int lo = 0;
        int hi = msAtStart.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (msAtStart[mid] <= ms) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo;
    }

    private static void validate(List<TempoRegion> regions) {
        if (regions.isEmpty()) {
            throw new IllegalArgumentException("tempo region list must not be empty");
        }
        if (regions.get(0).startStep() != 0.0) {
            throw new IllegalArgumentException(
                "first tempo region must start at step 0; actual = " + regions.get(0).startStep());
        }
        for (int i = 0; i < regions.size() - 1; i++) {
            TempoRegion current = regions.get(i);
            TempoRegion next = regions.get(i + 1);
            if (current.endStep() != next.startStep()) {
                throw new IllegalArgumentException(
                    "tempo regions must be contiguous: " + current + " then " + next);
            }
        }
        if (!regions.get(regions.size() - 1).isUnbounded()) {
            throw new IllegalArgumentException("last tempo region must be unbounded");
        }
    }

    @Override
    public String toString() {
        return "TempoMap{regions=" + regions.length + "}";
    }
}
