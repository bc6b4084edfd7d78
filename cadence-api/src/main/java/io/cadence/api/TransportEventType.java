package io.cadence.api;

/**
 * Discriminator of the transport event envelope.
 * wireName() is the identifier UI layers key their handlers on.
 */
public enum TransportEventType {

    STATE_CHANGE("state-change"),
    POSITION_UPDATE("position-update"),
    GHOST_POSITION_CHANGE("ghost-position-change");

    private final String wireName;

    TransportEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }

    /**
     * @throws IllegalArgumentException if no type has the given wire name
     */
    public static TransportEventType fromWireName(String wireName) {
        for (TransportEventType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown transport event type: '" + wireName + "'");
    }
}
