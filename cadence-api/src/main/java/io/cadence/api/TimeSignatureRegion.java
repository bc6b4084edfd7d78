package io.cadence.api;

/**
 * A contiguous stretch of the timeline in one meter.
 *
 * Partitioned independently of tempo regions. endStep is exclusive and the
 * last region is unbounded. A region whose length is not a whole number of
 * bars ends in a truncated bar; that bar still counts as one bar.
 */
public final class TimeSignatureRegion {

    private final double startStep;
    private final double endStep;
    private final TimeSignature timeSignature;

    /**
     * @param startStep     inclusive start; must be >= 0
     * @param endStep       exclusive end; must be > startStep, may be +infinity
     * @param timeSignature meter of the region; must not be null
     */
    public TimeSignatureRegion(double startStep, double endStep, TimeSignature timeSignature) {
        if (timeSignature == null) {
            throw new NullPointerException("timeSignature");
        }
        if (!(startStep >= 0.0)) {
            throw new IllegalArgumentException("startStep must be >= 0: " + startStep);
        }
        if (!(endStep > startStep)) {
            throw new IllegalArgumentException(
                "endStep must be > startStep: [" + startStep + ", " + endStep + ")");
        }
        this.startStep = startStep;
        this.endStep = endStep;
        this.timeSignature = timeSignature;
    }

    /** Convenience constructor from numerator/denominator. */
    public TimeSignatureRegion(double startStep, double endStep, int numerator, int denominator) {
        this(startStep, endStep, new TimeSignature(numerator, denominator));
    }

    public double startStep() { return startStep; }
    public double endStep() { return endStep; }
    public TimeSignature timeSignature() { return timeSignature; }

    public boolean isUnbounded() { return Double.isInfinite(endStep); }

    public double lengthSteps() { return endStep - startStep; }

    public boolean contains(double step) {
        return step >= startStep && step < endStep;
    }

    public double stepsPerBar() { return timeSignature.stepsPerBar(); }

    /**
     * Number of bars in this region, counting a truncated trailing bar as one.
     * Long.MAX_VALUE for the unbounded final region.
     */
    public long barCount() {
        if (isUnbounded()) {
            return Long.MAX_VALUE;
        }
        return (long) Math.ceil(lengthSteps() / stepsPerBar());
    }

    @Override
    public String toString() {
        return "TimeSignatureRegion{[" + startStep + ", " + endStep + "), " + timeSignature + "}";
    }
}
