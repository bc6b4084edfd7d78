package io.cadence.api;

/**
 * Immutable musical meter, e.g. 4/4, 3/4, 6/8.
 *
 * Bar length in steps = numerator * STEPS_PER_BEAT * (4 / denominator).
 * A 6/8 bar is therefore 12 steps; a 7/16 bar is 7 steps.
 */
public final class TimeSignature {

    /** Common time. Default meter of a new timeline. */
    public static final TimeSignature COMMON_TIME = new TimeSignature(4, 4);

    private final int numerator;
    private final int denominator;

    /**
     * @param numerator   beats per bar; must be positive
     * @param denominator note value of one beat; must be a power of two
     * @throws IllegalArgumentException on a non-positive numerator or a
     *                                  denominator that is not a power of two
     */
    public TimeSignature(int numerator, int denominator) {
        if (numerator <= 0) {
            throw new IllegalArgumentException("numerator must be positive: " + numerator);
        }
        if (denominator <= 0 || Integer.bitCount(denominator) != 1) {
            throw new IllegalArgumentException(
                "denominator must be a power of two: " + denominator);
        }
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public int numerator() { return numerator; }
    public int denominator() { return denominator; }

    /** Bar length in steps. */
    public double stepsPerBar() {
        return numerator * TransportConstants.STEPS_PER_BEAT * (4.0 / denominator);
    }

    /** Beats per bar as notated. */
    public int beatsPerBar() { return numerator; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeSignature other)) return false;
        return numerator == other.numerator && denominator == other.denominator;
    }

    @Override
    public int hashCode() {
        return 31 * numerator + denominator;
    }

    @Override
    public String toString() {
        return numerator + "/" + denominator;
    }
}
