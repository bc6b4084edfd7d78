package io.cadence.api;

/**
 * A named loop range kept by the timeline store.
 *
 * At most one loop region of a store is active at a time. end is forced
 * strictly greater than start at construction.
 */
public record LoopRegion(String id, double start, double end, String name, boolean active) {

    public LoopRegion {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("LoopRegion id must not be blank");
        }
        start = Math.max(0.0, start);
        end = Math.max(start + 1.0, end);
        if (name == null) {
            name = "Loop";
        }
    }

    public double lengthSteps() { return end - start; }

    public LoopRegion withActive(boolean isActive) {
        return new LoopRegion(id, start, end, name, isActive);
    }

    public LoopRegion withRange(double newStart, double newEnd) {
        return new LoopRegion(id, newStart, newEnd, name, active);
    }
}
