package io.cadence.timeline;

import io.cadence.api.BarBeat;
import io.cadence.api.TimeSignature;
import io.cadence.api.TimeSignatureRegion;
import io.cadence.api.TransportConstants;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable step <-> bar:beat:subdivision mapping over a timeline with meter changes.
 *
 * BAR NUMBERING:
 *   Bars are numbered continuously from 0. A region's first bar continues the
 *   count of every prior region; it never resets at a meter change. A region
 *   whose length is not a whole number of bars ends in a truncated bar, and that
 *   truncated bar is counted. The bar count at every region start is precomputed.
 *
 * BEAT MODEL:
 *   A beat is always STEPS_PER_BEAT steps (a quarter note), counted from the start
 *   of its bar. The last beat of a bar (or of a truncated bar) may be shorter;
 *   beats never cross a bar line.
 *
 * REGION CONTRACT (validated at construction): same as TempoMap.
 */
public final class MeterMap {

    private static final int STEPS_PER_BEAT = TransportConstants.STEPS_PER_BEAT;

    private final TimeSignatureRegion[] regions;

    /** barsBefore[i] = number of bars that precede regions[i]. */
    private final long[] barsBefore;

    private final List<TimeSignatureRegion> regionView;

    private MeterMap(List<TimeSignatureRegion> source) {
        this.regions = source.toArray(new TimeSignatureRegion[0]);
        this.barsBefore = new long[regions.length];
        long bars = 0L;
        for (int i = 0; i < regions.length; i++) {
            barsBefore[i] = bars;
            if (!regions[i].isUnbounded()) {
                bars += regions[i].barCount();
            }
        }
        this.regionView = Collections.unmodifiableList(List.of(regions));
    }

    /**
     * @param regions ordered, contiguous regions covering [0, +inf)
     * @throws IllegalArgumentException if the regions violate the contract
     */
    public static MeterMap of(List<TimeSignatureRegion> regions) {
        if (regions == null) {
            throw new NullPointerException("regions");
        }
        validate(regions);
        return new MeterMap(regions);
    }

    /** A single region in the given meter from 0 to +inf. */
    public static MeterMap constant(TimeSignature timeSignature) {
        return of(List.of(new TimeSignatureRegion(0.0, Double.POSITIVE_INFINITY, timeSignature)));
    }

    public List<TimeSignatureRegion> regions() { return regionView; }

    // -- Lookup ---------------------------------------------------------------

    /** Region containing step. Negative steps read the first region. */
    public TimeSignatureRegion regionAt(double step) {
        return regions[indexAt(step)];
    }

    public TimeSignature timeSignatureAt(double step) {
        return regionAt(step).timeSignature();
    }

    public double stepsPerBarAt(double step) {
        return regionAt(step).stepsPerBar();
    }

    public int beatsPerBarAt(double step) {
        return regionAt(step).timeSignature().beatsPerBar();
    }

    // -- Conversions ----------------------------------------------------------

    /**
     * Musical position of step. Negative steps are treated as 0.
     */
    public BarBeat stepToBarBeat(double step) {
        double s = Math.max(0.0, step);
        int i = indexAt(s);
        TimeSignatureRegion region = regions[i];
        double spb = region.stepsPerBar();
        double offset = s - region.startStep();
        long barInRegion = (long) Math.floor(offset / spb);
        double remaining = Math.max(0.0, offset - barInRegion * spb);
        int beat = (int) Math.floor(remaining / STEPS_PER_BEAT);
        double subdivision = remaining - (double) beat * STEPS_PER_BEAT;
        long bar = barsBefore[i] + barInRegion;
        return new BarBeat(saturatedInt(bar), beat, subdivision, region.timeSignature());
    }

    /**
     * Step of the given musical position. Exact left-inverse of stepToBarBeat for
     * integer triples that lie inside their bar. Negative bars are treated as 0.
     */
    public double barBeatToStep(int bar, int beat, double subdivision) {
        long b = Math.max(0, bar);
        int i = indexForBar(b);
        TimeSignatureRegion region = regions[i];
        return region.startStep()
            + (b - barsBefore[i]) * region.stepsPerBar()
            + (double) beat * STEPS_PER_BEAT
            + subdivision;
    }

    // -- Boundaries -----------------------------------------------------------

    /** Start of the bar containing step. */
    public double barStartAt(double step) {
        double s = Math.max(0.0, step);
        TimeSignatureRegion region = regionAt(s);
        double spb = region.stepsPerBar();
        double barInRegion = Math.floor((s - region.startStep()) / spb);
        return region.startStep() + barInRegion * spb;
    }

    /** Start of the bar after the one containing step; truncated bars end at their region end. */
    public double nextBarStartAt(double step) {
        double s = Math.max(0.0, step);
        TimeSignatureRegion region = regionAt(s);
        return Math.min(barStartAt(s) + region.stepsPerBar(), region.endStep());
    }

    /** Start of the beat containing step. */
    public double beatStartAt(double step) {
        double s = Math.max(0.0, step);
        double barStart = barStartAt(s);
        double beatInBar = Math.floor((s - barStart) / STEPS_PER_BEAT);
        return barStart + beatInBar * STEPS_PER_BEAT;
    }

    /** Start of the next beat; never past the next bar line. */
    public double nextBeatStartAt(double step) {
        return Math.min(beatStartAt(step) + STEPS_PER_BEAT, nextBarStartAt(step));
    }

    // -- Grid enumeration -----------------------------------------------------

    /**
     * Bar lines in [startStep, endStep], ascending.
     * A bar line on a meter change appears once, carrying the new meter.
     *
     * @throws IllegalArgumentException if endStep is infinite
     */
    public List<GridLine> barLines(double startStep, double endStep) {
        requireFinite(endStep);
        List<GridLine> lines = new ArrayList<>();
        if (!(endStep >= startStep)) {
            return lines;
        }
        double from = Math.max(0.0, startStep);
        for (TimeSignatureRegion region : regions) {
            if (region.startStep() > endStep) {
                break;
            }
            if (region.endStep() <= from) {
                continue;
            }
            double spb = region.stepsPerBar();
            double lo = Math.max(from, region.startStep());
            long k = (long) Math.ceil((lo - region.startStep()) / spb);
            for (;; k++) {
                double pos = region.startStep() + k * spb;
                if (pos > endStep || pos >= region.endStep()) {
                    break;
                }
                lines.add(new GridLine(pos, region.timeSignature()));
            }
        }
        return lines;
    }

    /**
     * Beat lines in [startStep, endStep], ascending, excluding every bar line.
     *
     * @throws IllegalArgumentException if endStep is infinite
     */
    public List<GridLine> beatLines(double startStep, double endStep) {
        requireFinite(endStep);
        List<GridLine> lines = new ArrayList<>();
        if (!(endStep >= startStep)) {
            return lines;
        }
        double from = Math.max(0.0, startStep);
        for (TimeSignatureRegion region : regions) {
            if (region.startStep() > endStep) {
                break;
            }
            if (region.endStep() <= from) {
                continue;
            }
            double spb = region.stepsPerBar();
            double lo = Math.max(from, region.startStep());
            long k = (long) Math.floor((lo - region.startStep()) / spb);
            for (;; k++) {
                double barStart = region.startStep() + k * spb;
                if (barStart > endStep || barStart >= region.endStep()) {
                    break;
                }
                double barEnd = Math.min(barStart + spb, region.endStep());
                for (int j = 1;; j++) {
                    double pos = barStart + (double) j * STEPS_PER_BEAT;
                    if (pos >= barEnd || pos > endStep) {
                        break;
                    }
                    if (pos >= from) {
                        lines.add(new GridLine(pos, region.timeSignature()));
                    }
                }
            }
        }
        return lines;
    }

    // -- Internal helpers -----------------------------------------------------

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

    private int indexForBar(long bar) {
        int lo = 0;
        int hi = barsBefore.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (barsBefore[mid] <= bar) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo;
    }

    private static int saturatedInt(long value) {
        return (int) Math.min(Integer.MAX_VALUE, value);
    }

    private static void requireFinite(double endStep) {
        if (Double.isInfinite(endStep)) {
            throw new IllegalArgumentException("grid range end must be finite");
        }
    }

    private static void validate(List<TimeSignatureRegion> regions) {
        if (regions.isEmpty()) {
            throw new IllegalArgumentException("time signature region list must not be empty");
        }
        if (regions.get(0).startStep() != 0.0) {
            throw new IllegalArgumentException(
                "first time signature region must start at step 0; actual = " +
                regions.get(0).startStep());
        }
        for (int i = 0; i < regions.size() - 1; i++) {
            TimeSignatureRegion current = regions.get(i);
            TimeSignatureRegion next = regions.get(i + 1);
            if (current.endStep() != next.startStep()) {
                throw new IllegalArgumentException(
                    "time signature regions must be contiguous: " + current + " then " + next);
            }
        }
        if (!regions.get(regions.size() - 1).isUnbounded()) {
            throw new IllegalArgumentException("last time signature region must be unbounded");
        }
    }

    @Override
    public String toString() {
        return "MeterMap{regions=" + regions.length + "}";
    }
}
