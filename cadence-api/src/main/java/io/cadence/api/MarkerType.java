package io.cadence.api;

/**
 * Category of a timeline marker. Affects display only; every type is a
 * valid snap target.
 */
public enum MarkerType {
    /** Song section boundary: intro, verse, chorus. */
    SECTION,
    /** Loop point annotation. */
    LOOP,
    /** Free-form user bookmark. Default for new markers. */
    BOOKMARK,
    /** Arrangement block boundary. */
    ARRANGEMENT
}
