package io.cadence.api;

/**
 * A named point on the timeline.
 *
 * @param id       store-assigned identifier, e.g. "marker_3"
 * @param position step position; >= 0
 * @param name     display label; never null
 * @param type     display category
 */
public record Marker(String id, double position, String name, MarkerType type) {

    public Marker {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Marker id must not be blank");
        }
        if (!(position >= 0.0)) {
            throw new IllegalArgumentException("Marker position must be >= 0: " + position);
        }
        if (name == null) {
            name = "";
        }
        if (type == null) {
            type = MarkerType.BOOKMARK;
        }
    }

    public Marker withPosition(double newPosition) {
        return new Marker(id, newPosition, name, type);
    }

    public Marker withName(String newName) {
        return new Marker(id, position, newName, type);
    }
}
