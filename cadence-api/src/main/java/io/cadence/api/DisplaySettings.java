package io.cadence.api;

/**
 * Timeline ruler and snapping preferences.
 *
 * IMMUTABLE: the store replaces the whole settings object on update.
 * Only snapToMarkers affects coordinate math; the rest is passed through
 * to renderers.
 */
public final class DisplaySettings {

    /** Everything visible, marker snapping on, 30 px ruler. */
    public static final DisplaySettings DEFAULTS = builder().build();

    private final boolean snapToMarkers;
    private final boolean showTimeSignature;
    private final boolean showTempo;
    private final boolean showMarkers;
    private final boolean showLoopRegions;
    private final boolean showBars;
    private final boolean showBeats;
    private final boolean showSubdivisions;
    private final int rulerHeight;

    private DisplaySettings(Builder builder) {
        this.snapToMarkers = builder.snapToMarkers;
        this.showTimeSignature = builder.showTimeSignature;
        this.showTempo = builder.showTempo;
        this.showMarkers = builder.showMarkers;
        this.showLoopRegions = builder.showLoopRegions;
        this.showBars = builder.showBars;
        this.showBeats = builder.showBeats;
        this.showSubdivisions = builder.showSubdivisions;
        this.rulerHeight = builder.rulerHeight;
    }

    public boolean snapToMarkers() { return snapToMarkers; }
    public boolean showTimeSignature() { return showTimeSignature; }
    public boolean showTempo() { return showTempo; }
    public boolean showMarkers() { return showMarkers; }
    public boolean showLoopRegions() { return showLoopRegions; }
    public boolean showBars() { return showBars; }
    public boolean showBeats() { return showBeats; }
    public boolean showSubdivisions() { return showSubdivisions; }
    public int rulerHeight() { return rulerHeight; }

    /** Returns a builder pre-filled with this instance's values. */
    public Builder toBuilder() {
        return new Builder()
            .snapToMarkers(snapToMarkers)
            .showTimeSignature(showTimeSignature)
            .showTempo(showTempo)
            .showMarkers(showMarkers)
            .showLoopRegions(showLoopRegions)
            .showBars(showBars)
            .showBeats(showBeats)
            .showSubdivisions(showSubdivisions)
            .rulerHeight(rulerHeight);
    }

    @Override
    public String toString() {
        return "DisplaySettings{snapToMarkers=" + snapToMarkers +
            ", rulerHeight=" + rulerHeight + "}";
    }

    // -- Builder --------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private boolean snapToMarkers = true;
        private boolean showTimeSignature = true;
        private boolean showTempo = true;
        private boolean showMarkers = true;
        private boolean showLoopRegions = true;
        private boolean showBars = true;
        private boolean showBeats = true;
        private boolean showSubdivisions = true;
        private int rulerHeight = 30;

        private Builder() {}

        public Builder snapToMarkers(boolean v) { this.snapToMarkers = v; return this; }
        public Builder showTimeSignature(boolean v) { this.showTimeSignature = v; return this; }
        public Builder showTempo(boolean v) { this.showTempo = v; return this; }
        public Builder showMarkers(boolean v) { this.showMarkers = v; return this; }
        public Builder showLoopRegions(boolean v) { this.showLoopRegions = v; return this; }
        public Builder showBars(boolean v) { this.showBars = v; return this; }
        public Builder showBeats(boolean v) { this.showBeats = v; return this; }
        public Builder showSubdivisions(boolean v) { this.showSubdivisions = v; return this; }

        /** Ruler height in pixels; clamped to >= 0. */
        public Builder rulerHeight(int v) { this.rulerHeight = Math.max(0, v); return this; }

        public DisplaySettings build() {
            return new DisplaySettings(this);
        }
    }
}
