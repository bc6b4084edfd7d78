package io.cadence.timeline;

import io.cadence.api.BarBeat;
import io.cadence.api.Marker;
import io.cadence.api.TempoRegion;
import io.cadence.api.TimeSignature;
import io.cadence.api.TimelineStore;
import io.cadence.api.TransportConstants;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversions between the four coordinate spaces of the timeline:
 *
 *   steps        - internal time unit, one sixteenth note
 *   pixels       - step * baseStepWidth * zoom
 *   bar:beat:sub - musical notation, continuous bar numbering across meter changes
 *   milliseconds - wall-clock time under the tempo map
 *
 * All methods are pure functions of their arguments and the timeline store's
 * current regions.
 *
 * CACHE DISCIPLINE:
 *   The TempoMap and MeterMap built from the store's region snapshot are cached
 *   together with the store generation they were built from. Every call compares
 *   that generation to store.generation() and rebuilds on mismatch, so a timeline
 *   edit can never be served from a stale cache. clearCache() forces a rebuild.
 *   The step width is memoized per (zoom, baseStepWidth) pair.
 *
 * THREAD SAFETY:
 *   Safe for concurrent readers. The cache is a single volatile reference to an
 *   immutable record; racing rebuilds produce equivalent maps and the last one wins.
 */
public final class TimelineCoordinateSystem {

    private static final Logger log = LoggerFactory.getLogger(TimelineCoordinateSystem.class);

    private static final long NO_GENERATION = Long.MIN_VALUE;

    private final TimelineStore timelineStore;

    private volatile RegionCache regionCache = null;
    private volatile StepWidthCache stepWidthCache = null;

    /**
     * @param timelineStore source of tempo/meter regions, markers and display settings
     */
    public TimelineCoordinateSystem(TimelineStore timelineStore) {
        if (timelineStore == null) {
            throw new NullPointerException("timelineStore");
        }
        this.timelineStore = timelineStore;
    }

    // -- Step <-> pixel -------------------------------------------------------

    /** step * baseStepWidth * zoom. */
    public double stepToPixel(double step, double zoom, double baseStepWidth) {
        return step * stepWidth(zoom, baseStepWidth);
    }

    /** stepToPixel at zoom 1.0 and the default base width. */
    public double stepToPixel(double step) {
        return stepToPixel(step, 1.0, TransportConstants.DEFAULT_BASE_STEP_WIDTH);
    }

    /** Algebraic inverse of stepToPixel. */
    public double pixelToStep(double pixel, double zoom, double baseStepWidth) {
        return pixel / stepWidth(zoom, baseStepWidth);
    }

    public double pixelToStep(double pixel) {
        return pixelToStep(pixel, 1.0, TransportConstants.DEFAULT_BASE_STEP_WIDTH);
    }

    // -- Step <-> bar/beat ----------------------------------------------------

    public BarBeat stepToBarBeat(double step) {
        return meterMap().stepToBarBeat(step);
    }

    /**
     * @param bar         0-indexed bar, continuous across meter changes
     * @param beat        0-indexed beat within the bar
     * @param subdivision step offset within the beat
     */
    public double barBeatToStep(int bar, int beat, double subdivision) {
        return meterMap().barBeatToStep(bar, beat, subdivision);
    }

    /** First step of the given bar. */
    public double barBeatToStep(int bar) {
        return barBeatToStep(bar, 0, 0.0);
    }

    public int barAtStep(double step) {
        return stepToBarBeat(step).bar();
    }

    public int beatAtStep(double step) {
        return stepToBarBeat(step).beat();
    }

    // -- Step <-> milliseconds ------------------------------------------------

    public double stepToMs(double step) {
        return tempoMap().stepToMs(step);
    }

    public double msToStep(double ms) {
        return tempoMap().msToStep(ms);
    }

    /** (60000 / bpm) / STEPS_PER_BEAT. */
    public double msPerStep(double bpm) {
        return TempoRegion.msPerStep(bpm);
    }

    public double tempoAt(double step) {
        return tempoMap().tempoAt(step);
    }

    // -- Grid -----------------------------------------------------------------

    /**
     * Every multiple of snapValue in [startStep, endStep].
     * Empty if snapValue is not positive or the range is empty.
     */
    public List<Double> gridSnapPositions(double startStep, double endStep, double snapValue) {
        List<Double> positions = new ArrayList<>();
        if (!(snapValue > 0.0) || !(endStep >= startStep) || Double.isInfinite(endStep)) {
            return positions;
        }
        long first = (long) Math.ceil(startStep / snapValue);
        for (long k = first;; k++) {
            double pos = k * snapValue;
            if (pos > endStep) {
                break;
            }
            positions.add(pos);
        }
        return positions;
    }

    /** Bar lines in [startStep, endStep]; see MeterMap.barLines. */
    public List<GridLine> barLinePositions(double startStep, double endStep) {
        return meterMap().barLines(startStep, endStep);
    }

    /** Beat lines in [startStep, endStep], bar lines excluded; see MeterMap.beatLines. */
    public List<GridLine> beatLinePositions(double startStep, double endStep) {
        return meterMap().beatLines(startStep, endStep);
    }

    // -- Snapping -------------------------------------------------------------

    /** Nearest multiple of snapValue. Returns step unchanged if snapValue is not positive. */
    public double snapToGrid(double step, double snapValue) {
        if (!(snapValue > 0.0)) {
            return step;
        }
        return Math.round(step / snapValue) * snapValue;
    }

    /** Nearest bar start. Ties go to the later bar. */
    public double snapToBar(double step) {
        MeterMap meter = meterMap();
        return nearer(step, meter.barStartAt(step), meter.nextBarStartAt(step));
    }

    /** Nearest beat start. Ties go to the later beat. */
    public double snapToBeat(double step) {
        MeterMap meter = meterMap();
        return nearer(step, meter.beatStartAt(step), meter.nextBeatStartAt(step));
    }

    /**
     * Position of the nearest marker strictly within threshold, if marker snapping
     * is enabled in the display settings; step unchanged otherwise.
     */
    public double snapToMarker(double step, double threshold) {
        if (!timelineStore.displaySettings().snapToMarkers()) {
            return step;
        }
        Optional<Marker> nearest = timelineStore.nearestMarker(step, threshold);
        return nearest.map(Marker::position).orElse(step);
    }

    public double snapToMarker(double step) {
        return snapToMarker(step, TransportConstants.DEFAULT_MARKER_SNAP_THRESHOLD);
    }

    // -- Meter queries --------------------------------------------------------

    public double stepsPerBarAt(double step) {
        return meterMap().stepsPerBarAt(step);
    }

    public int beatsPerBarAt(double step) {
        return meterMap().beatsPerBarAt(step);
    }

    public TimeSignature timeSignatureAt(double step) {
        return meterMap().timeSignatureAt(step);
    }

    // -- Formatting -----------------------------------------------------------

    /** 1-indexed "bar:beat:sub", e.g. "1:1:1" at step 0. */
    public String formatPosition(double step) {
        return stepToBarBeat(step).format();
    }

    /** "MM:SS:mmm" of the wall-clock time at step. */
    public String formatTimecode(double step) {
        long ms = (long) Math.floor(stepToMs(step));
        long totalSeconds = ms / 1000L;
        return String.format("%02d:%02d:%03d", totalSeconds / 60L, totalSeconds % 60L, ms % 1000L);
    }

    // -- Cache ----------------------------------------------------------------

    /** Drops every memoized value. The next call rebuilds from the store. */
    public void clearCache() {
        regionCache = null;
        stepWidthCache = null;
    }

    /** Store generation the cached maps were built from, or Long.MIN_VALUE if none. */
    public long cachedGeneration() {
        RegionCache cache = regionCache;
        return cache != null ? cache.generation() : NO_GENERATION;
    }

    public TempoMap tempoMap() {
        return regions().tempoMap();
    }

    public MeterMap meterMap() {
        return regions().meterMap();
    }

    // -- Internal helpers -----------------------------------------------------

    private RegionCache regions() {
        long generation = timelineStore.generation();
        RegionCache cache = regionCache;
        if (cache != null && cache.generation() == generation) {
            return cache;
        }
        RegionCache rebuilt = new RegionCache(
            generation,
            TempoMap.of(timelineStore.tempoRegions()),
            MeterMap.of(timelineStore.timeSignatureRegions()));
        regionCache = rebuilt;
        log.debug("Rebuilt timeline region cache at generation {}", generation);
        return rebuilt;
    }

    private double stepWidth(double zoom, double baseStepWidth) {
        StepWidthCache cache = stepWidthCache;
        if (cache != null && cache.zoom() == zoom && cache.baseStepWidth() == baseStepWidth) {
            return cache.stepWidth();
        }
        if (!(zoom > 0.0) || !(baseStepWidth > 0.0)) {
            throw new IllegalArgumentException(
                "zoom and baseStepWidth must be positive; zoom=" + zoom +
                ", baseStepWidth=" + baseStepWidth);
        }
        double width = baseStepWidth * zoom;
        stepWidthCache = new StepWidthCache(zoom, baseStepWidth, width);
        return width;
    }

    private static double nearer(double step, double before, double after) {
        return (step - before) < (after - step) ? before : after;
    }

    private record RegionCache(long generation, TempoMap tempoMap, MeterMap meterMap) {}

    private record StepWidthCache(double zoom, double baseStepWidth, double stepWidth) {}
}
