package io.studiograph.core.model;

import java.util.Objects;

/**
 * An input or output jack on an instrument.
 * <p>
 * The id is unique within the owning instrument and direction; connections refer
 * to ports by this id (the connection's source or target "handle").
 * </p>
 */
public record Port(
    String id,
    String label,
    PortType type
) {
    public Port {
        Objects.requireNonNull(id, "id cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
        Objects.requireNonNull(type, "type cannot be null");
        label = label == null ? id : label;
    }

    public static Port of(String id, String label, PortType type) {
        return new Port(id, label, type);
    }

    /**
     * Returns a copy of this port with a different id, keeping label and medium.
     */
    public Port withId(String newId) {
        return new Port(newId, label, type);
    }
}
