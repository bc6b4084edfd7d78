package io.cadence.api;

/**
 * A position in musical notation.
 *
 * bar and beat are 0-indexed; subdivision is the step offset inside the beat,
 * in [0..STEPS_PER_BEAT). Subdivision stays fractional for swung or tuplet
 * positions. Bars are numbered continuously across meter changes.
 */
public record BarBeat(int bar, int beat, double subdivision, TimeSignature timeSignature) {

    public BarBeat {
        if (timeSignature == null) {
            throw new NullPointerException("timeSignature");
        }
    }

    /** 1-indexed display form, e.g. "1:1:1" for the very first step. */
    public String format() {
        return (bar + 1) + ":" + (beat + 1) + ":" + ((int) Math.floor(subdivision) + 1);
    }
}
