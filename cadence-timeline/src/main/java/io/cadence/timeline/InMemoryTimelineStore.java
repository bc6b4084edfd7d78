package io.cadence.timeline;

import io.cadence.api.BarBeat;
import io.cadence.api.DisplaySettings;
import io.cadence.api.LoopRegion;
import io.cadence.api.Marker;
import io.cadence.api.MarkerType;
import io.cadence.api.TempoRegion;
import io.cadence.api.TimeSignature;
import io.cadence.api.TimeSignatureRegion;
import io.cadence.api.TimelineStore;
import io.cadence.api.TransportConstants;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reference TimelineStore held entirely in memory.
 *
 * Holds the editable timeline document: tempo markers, time signature markers,
 * named markers, loop regions and display settings. Regions handed to the
 * coordinate system are derived from the marker lists on demand.
 *
 * ANCHOR MARKERS:
 *   The first tempo marker and the first time signature marker sit at step 0 and
 *   can never be removed or moved, so the derived regions always cover [0, +inf).
 *   Adding or moving a marker onto a position that already holds one replaces
 *   the existing marker; at step 0 the anchor keeps its id and takes the new value.
 *
 * GENERATION COUNTER:
 *   generation() increments on every successful edit. The derived TempoMap and
 *   MeterMap are dropped on every edit and rebuilt lazily.
 *
 * THREAD SAFETY:
 *   All edits and reads are synchronized on this store. generation() is lock-free.
 */
public final class InMemoryTimelineStore implements TimelineStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTimelineStore.class);

    private static final Comparator<TempoMarker> TEMPO_ORDER =
        Comparator.comparingDouble(TempoMarker::position);
    private static final Comparator<TimeSignatureMarker> METER_ORDER =
        Comparator.comparingDouble(TimeSignatureMarker::position);
    private static final Comparator<Marker> MARKER_ORDER =
        Comparator.comparingDouble(Marker::position);

    private final AtomicLong idSequence = new AtomicLong(1L);
    private final AtomicLong generation = new AtomicLong(0L);

    private final List<TempoMarker> tempoMarkers = new ArrayList<>();
    private final List<TimeSignatureMarker> timeSignatureMarkers = new ArrayList<>();
    private final List<Marker> markers = new ArrayList<>();
    private final List<LoopRegion> loopRegions = new ArrayList<>();

    private String activeLoopRegionId = null;
    private DisplaySettings displaySettings = DisplaySettings.DEFAULTS;

    private TempoMap tempoMap = null;
    private MeterMap meterMap = null;

    /** 4/4 at DEFAULT_BPM, no markers, no loop regions. */
    public InMemoryTimelineStore() {
        this(TransportConstants.DEFAULT_BPM, TimeSignature.COMMON_TIME);
    }

    /**
     * @param initialBpm           tempo of the anchor tempo marker
     * @param initialTimeSignature meter of the anchor time signature marker
     */
    public InMemoryTimelineStore(double initialBpm, TimeSignature initialTimeSignature) {
        if (initialTimeSignature == null) {
            throw new NullPointerException("initialTimeSignature");
        }
        tempoMarkers.add(new TempoMarker("tempo_0", 0.0, initialBpm));
        timeSignatureMarkers.add(new TimeSignatureMarker("ts_0", 0.0, initialTimeSignature));
    }

    // -- TimelineStore --------------------------------------------------------

    @Override
    public synchronized List<TempoRegion> tempoRegions() {
        return tempoMap().regions();
    }

    @Override
    public synchronized List<TimeSignatureRegion> timeSignatureRegions() {
        return meterMap().regions();
    }

    @Override
    public synchronized double tempoAt(double step) {
        return tempoMap().tempoAt(step);
    }

    @Override
    public synchronized TimeSignature timeSignatureAt(double step) {
        return meterMap().timeSignatureAt(step);
    }

    @Override
    public synchronized Optional<Marker> nearestMarker(double step, double threshold) {
        Marker nearest = null;
        double minDistance = threshold;
        for (Marker marker : markers) {
            double distance = Math.abs(marker.position() - step);
            if (distance < minDistance) {
                minDistance = distance;
                nearest = marker;
            }
        }
        return Optional.ofNullable(nearest);
    }

    @Override
    public synchronized DisplaySettings displaySettings() {
        return displaySettings;
    }

    @Override
    public long generation() {
        return generation.get();
    }

    // -- Musical position -----------------------------------------------------

    public synchronized BarBeat stepToBarBeat(double step) {
        return meterMap().stepToBarBeat(step);
    }

    public synchronized double barBeatToStep(int bar, int beat, double subdivision) {
        return meterMap().barBeatToStep(bar, beat, subdivision);
    }

    public synchronized double stepsPerBarAt(double step) {
        return meterMap().stepsPerBarAt(step);
    }

    public synchronized int beatsPerBarAt(double step) {
        return meterMap().beatsPerBarAt(step);
    }

    // -- Tempo markers --------------------------------------------------------

    /** Snapshot of the tempo markers, ascending by position. */
    public synchronized List<TempoMarker> tempoMarkers() {
        return List.copyOf(tempoMarkers);
    }

    /**
     * Adds a tempo change. Replaces any marker already at that position.
     *
     * @return id of the marker now holding the position
     * @throws IllegalArgumentException if bpm is not positive
     */
    public synchronized String addTempoMarker(double position, double bpm) {
        double pos = Math.max(0.0, position);
        if (pos == 0.0) {
            TempoMarker anchor = tempoMarkers.get(0);
            tempoMarkers.set(0, new TempoMarker(anchor.id(), 0.0, bpm));
            edited("tempo marker " + anchor.id());
            return anchor.id();
        }
        String id = "tempo_" + idSequence.getAndIncrement();
        TempoMarker marker = new TempoMarker(id, pos, bpm);
        tempoMarkers.removeIf(m -> m.position() == pos);
        tempoMarkers.add(marker);
        tempoMarkers.sort(TEMPO_ORDER);
        edited("tempo marker " + id);
        return id;
    }

    /** Removes a tempo marker. The anchor at step 0 cannot be removed. */
    public synchronized boolean removeTempoMarker(String id) {
        int index = indexOfTempo(id);
        if (index <= 0) {
            return false;
        }
        tempoMarkers.remove(index);
        edited("tempo marker " + id);
        return true;
    }

    /**
     * Moves and/or retimes a tempo marker. The anchor keeps position 0.
     * Moving a marker onto step 0 folds its tempo into the anchor.
     */
    public synchronized boolean updateTempoMarker(String id, double position, double bpm) {
        int index = indexOfTempo(id);
        if (index < 0) {
            return false;
        }
        if (index == 0) {
            tempoMarkers.set(0, new TempoMarker(id, 0.0, bpm));
            edited("tempo marker " + id);
            return true;
        }
        TempoMarker updated = new TempoMarker(id, Math.max(0.0, position), bpm);
        tempoMarkers.remove(index);
        if (updated.position() == 0.0) {
            TempoMarker anchor = tempoMarkers.get(0);
            tempoMarkers.set(0, new TempoMarker(anchor.id(), 0.0, bpm));
        } else {
            tempoMarkers.removeIf(m -> m.position() == updated.position());
            tempoMarkers.add(updated);
            tempoMarkers.sort(TEMPO_ORDER);
        }
        edited("tempo marker " + id);
        return true;
    }

    // -- Time signature markers -----------------------------------------------

    public synchronized List<TimeSignatureMarker> timeSignatureMarkers() {
        return List.copyOf(timeSignatureMarkers);
    }

    /**
     * Adds a meter change. Replaces any marker already at that position.
     *
     * @return id of the marker now holding the position
     * @throws IllegalArgumentException on an invalid time signature
     */
    public synchronized String addTimeSignature(double position, int numerator, int denominator) {
        TimeSignature signature = new TimeSignature(numerator, denominator);
        double pos = Math.max(0.0, position);
        if (pos == 0.0) {
            TimeSignatureMarker anchor = timeSignatureMarkers.get(0);
            timeSignatureMarkers.set(0, new TimeSignatureMarker(anchor.id(), 0.0, signature));
            edited("time signature " + anchor.id());
            return anchor.id();
        }
        String id = "ts_" + idSequence.getAndIncrement();
        timeSignatureMarkers.removeIf(m -> m.position() == pos);
        timeSignatureMarkers.add(new TimeSignatureMarker(id, pos, signature));
        timeSignatureMarkers.sort(METER_ORDER);
        edited("time signature " + id);
        return id;
    }

    /** Removes a meter change. The anchor at step 0 cannot be removed. */
    public synchronized boolean removeTimeSignature(String id) {
        int index = indexOfMeter(id);
        if (index <= 0) {
            return false;
        }
        timeSignatureMarkers.remove(index);
        edited("time signature " + id);
        return true;
    }

    /** Moves and/or changes a meter marker. The anchor keeps position 0. */
    public synchronized boolean updateTimeSignature(String id, double position,
                                                    TimeSignature timeSignature) {
        int index = indexOfMeter(id);
        if (index < 0) {
            return false;
        }
        if (index == 0) {
            timeSignatureMarkers.set(0, new TimeSignatureMarker(id, 0.0, timeSignature));
            edited("time signature " + id);
            return true;
        }
        TimeSignatureMarker updated =
            new TimeSignatureMarker(id, Math.max(0.0, position), timeSignature);
        timeSignatureMarkers.remove(index);
        if (updated.position() == 0.0) {
            TimeSignatureMarker anchor = timeSignatureMarkers.get(0);
            timeSignatureMarkers.set(0, new TimeSignatureMarker(anchor.id(), 0.0, timeSignature));
        } else {
            timeSignatureMarkers.removeIf(m -> m.position() == updated.position());
            timeSignatureMarkers.add(updated);
            timeSignatureMarkers.sort(METER_ORDER);
        }
        edited("time signature " + id);
        return true;
    }

    // -- Markers --------------------------------------------------------------

    public synchronized List<Marker> markers() {
        return List.copyOf(markers);
    }

    /** Adds a named marker. @return the new marker's id */
    public synchronized String addMarker(double position, String name, MarkerType type) {
        String id = "marker_" + idSequence.getAndIncrement();
        markers.add(new Marker(id, Math.max(0.0, position), name, type));
        markers.sort(MARKER_ORDER);
        edited("marker " + id);
        return id;
    }

    /** Adds a BOOKMARK marker. */
    public String addMarker(double position, String name) {
        return addMarker(position, name, MarkerType.BOOKMARK);
    }

    public synchronized boolean removeMarker(String id) {
        boolean removed = markers.removeIf(m -> m.id().equals(id));
        if (removed) {
            edited("marker " + id);
        }
        return removed;
    }

    public synchronized boolean moveMarker(String id, double position) {
        for (int i = 0; i < markers.size(); i++) {
            if (markers.get(i).id().equals(id)) {
                markers.set(i, markers.get(i).withPosition(Math.max(0.0, position)));
                markers.sort(MARKER_ORDER);
                edited("marker " + id);
                return true;
            }
        }
        return false;
    }

    public synchronized boolean renameMarker(String id, String name) {
        for (int i = 0; i < markers.size(); i++) {
            if (markers.get(i).id().equals(id)) {
                markers.set(i, markers.get(i).withName(name));
                edited("marker " + id);
                return true;
            }
        }
        return false;
    }

    /** Markers with startPosition <= position <= endPosition, ascending. */
    public synchronized List<Marker> markersInRange(double startPosition, double endPosition) {
        List<Marker> inRange = new ArrayList<>();
        for (Marker marker : markers) {
            if (marker.position() >= startPosition && marker.position() <= endPosition) {
                inRange.add(marker);
            }
        }
        return inRange;
    }

    // -- Loop regions ---------------------------------------------------------

    public synchronized List<LoopRegion> loopRegions() {
        return List.copyOf(loopRegions);
    }

    /** Adds an inactive loop region. end is forced > start. @return the new region's id */
    public synchronized String addLoopRegion(double start, double end, String name) {
        String id = "loop_" + idSequence.getAndIncrement();
        loopRegions.add(new LoopRegion(id, start, end, name, false));
        edited("loop region " + id);
        return id;
    }

    /** Removes a loop region, clearing the active selection if it pointed here. */
    public synchronized boolean removeLoopRegion(String id) {
        boolean removed = loopRegions.removeIf(lr -> lr.id().equals(id));
        if (removed) {
            if (id.equals(activeLoopRegionId)) {
                activeLoopRegionId = null;
            }
            edited("loop region " + id);
        }
        return removed;
    }

    public synchronized boolean updateLoopRegion(String id, double start, double end) {
        for (int i = 0; i < loopRegions.size(); i++) {
            if (loopRegions.get(i).id().equals(id)) {
                loopRegions.set(i, loopRegions.get(i).withRange(start, end));
                edited("loop region " + id);
                return true;
            }
        }
        return false;
    }

    /**
     * Makes the given region the only active one. A null id clears the selection.
     *
     * @return false if id is not null and no such region exists
     */
    public synchronized boolean setActiveLoopRegion(String id) {
        if (id != null && loopRegions.stream().noneMatch(lr -> lr.id().equals(id))) {
            return false;
        }
        loopRegions.replaceAll(lr -> lr.withActive(lr.id().equals(id)));
        activeLoopRegionId = id;
        edited("active loop region " + id);
        return true;
    }

    public synchronized Optional<LoopRegion> activeLoopRegion() {
        if (activeLoopRegionId == null) {
            return Optional.empty();
        }
        return loopRegions.stream().filter(lr -> lr.id().equals(activeLoopRegionId)).findFirst();
    }

    public void clearActiveLoopRegion() {
        setActiveLoopRegion(null);
    }

    // -- Display settings -----------------------------------------------------

    public synchronized void updateDisplaySettings(DisplaySettings settings) {
        if (settings == null) {
            throw new NullPointerException("settings");
        }
        this.displaySettings = settings;
        edited("display settings");
    }

    // -- Reset ----------------------------------------------------------------

    /** Back to a single 4/4 and DEFAULT_BPM anchor, no markers, no loop regions. */
    public synchronized void reset() {
        tempoMarkers.clear();
        tempoMarkers.add(new TempoMarker("tempo_0", 0.0, TransportConstants.DEFAULT_BPM));
        timeSignatureMarkers.clear();
        timeSignatureMarkers.add(new TimeSignatureMarker("ts_0", 0.0, TimeSignature.COMMON_TIME));
        markers.clear();
        loopRegions.clear();
        activeLoopRegionId = null;
        edited("reset");
    }

    // -- Internal helpers -----------------------------------------------------

    private void edited(String what) {
        tempoMap = null;
        meterMap = null;
        long gen = generation.incrementAndGet();
        log.debug("Timeline edited: {} (generation {})", what, gen);
    }

    private TempoMap tempoMap() {
        if (tempoMap == null) {
            List<TempoRegion> regions = new ArrayList<>(tempoMarkers.size());
            for (int i = 0; i < tempoMarkers.size(); i++) {
                TempoMarker current = tempoMarkers.get(i);
                double end = (i + 1 < tempoMarkers.size())
                    ? tempoMarkers.get(i + 1).position()
                    : Double.POSITIVE_INFINITY;
                regions.add(new TempoRegion(current.position(), end, current.bpm()));
            }
            tempoMap = TempoMap.of(Collections.unmodifiableList(regions));
        }
        return tempoMap;
    }

    private MeterMap meterMap() {
        if (meterMap == null) {
            List<TimeSignatureRegion> regions = new ArrayList<>(timeSignatureMarkers.size());
            for (int i = 0; i < timeSignatureMarkers.size(); i++) {
                TimeSignatureMarker current = timeSignatureMarkers.get(i);
                double end = (i + 1 < timeSignatureMarkers.size())
                    ? timeSignatureMarkers.get(i + 1).position()
                    : Double.POSITIVE_INFINITY;
                regions.add(new TimeSignatureRegion(current.position(), end, current.timeSignature()));
            }
            meterMap = MeterMap.of(Collections.unmodifiableList(regions));
        }
        return meterMap;
    }

    private int indexOfTempo(String id) {
        for (int i = 0; i < tempoMarkers.size(); i++) {
            if (tempoMarkers.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    private int indexOfMeter(String id) {
        for (int i = 0; i < timeSignatureMarkers.size(); i++) {
            if (timeSignatureMarkers.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }
}
