package io.cadence.api;

/**
 * A contiguous stretch of the timeline played at one fixed tempo.
 *
 * endStep is exclusive. The last region of a timeline is unbounded
 * (endStep = Double.POSITIVE_INFINITY).
 *
 * IMMUTABLE: regions are derived from the timeline store's tempo markers
 * and handed out as snapshots.
 */
public final class TempoRegion {

    private final double startStep;
    private final double endStep;
    private final double bpm;

    /**
     * @param startStep inclusive start; must be >= 0
     * @param endStep   exclusive end; must be > startStep, may be +infinity
     * @param bpm       tempo; must be positive
     */
    public TempoRegion(double startStep, double endStep, double bpm) {
        if (!(startStep >= 0.0)) {
            throw new IllegalArgumentException("startStep must be >= 0: " + startStep);
        }
        if (!(endStep > startStep)) {
            throw new IllegalArgumentException(
                "endStep must be > startStep: [" + startStep + ", " + endStep + ")");
        }
        if (!(bpm > 0.0) || Double.isInfinite(bpm)) {
            throw new IllegalArgumentException("bpm must be positive and finite: " + bpm);
        }
        this.startStep = startStep;
        this.endStep = endStep;
        this.bpm = bpm;
    }

    public double startStep() { return startStep; }
    public double endStep() { return endStep; }
    public double bpm() { return bpm; }

    /** True for the open-ended final region. */
    public boolean isUnbounded() { return Double.isInfinite(endStep); }

    /** Region length in steps. Infinite for the final region. */
    public double lengthSteps() { return endStep - startStep; }

    /** True if step lies in [startStep, endStep). */
    public boolean contains(double step) {
        return step >= startStep && step < endStep;
    }

    /** Duration of one step at this region's tempo. */
    public double msPerStep() { return msPerStep(bpm); }

    /**
     * Duration of one step (sixteenth note) at the given tempo:
     * (60000 / bpm) / STEPS_PER_BEAT.
     */
    public static double msPerStep(double bpm) {
        return (TransportConstants.MS_PER_MINUTE / bpm) / TransportConstants.STEPS_PER_BEAT;
    }

    @Override
    public String toString() {
        return "TempoRegion{[" + startStep + ", " + endStep + "), bpm=" + bpm + "}";
    }
}
