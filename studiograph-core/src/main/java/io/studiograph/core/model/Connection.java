package io.studiograph.core.model;

import java.util.Objects;

/**
 * A directed edge from one instrument's output port to another instrument's input port.
 * <p>
 * The id is derived from the four endpoint values, so two structurally identical
 * connections share an id and adding one twice is a no-op.
 * </p>
 */
public record Connection(
    String id,
    String source,
    String sourceHandle,
    String target,
    String targetHandle,
    PortType medium
) {
    public Connection {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(sourceHandle, "sourceHandle cannot be null");
        Objects.requireNonNull(target, "target cannot be null");
        Objects.requireNonNull(targetHandle, "targetHandle cannot be null");
        Objects.requireNonNull(medium, "medium cannot be null");
        if (id == null || id.isBlank()) {
            id = idFor(source, sourceHandle, target, targetHandle);
        }
    }

    /**
     * Creates a connection whose id is derived from its endpoints.
     */
    public static Connection of(
        String source,
        String sourceHandle,
        String target,
        String targetHandle,
        PortType medium
    ) {
        return new Connection(
            idFor(source, sourceHandle, target, targetHandle),
            source,
            sourceHandle,
            target,
            targetHandle,
            medium
        );
    }

    /**
     * Derives the connection id {@code edge-{source}-{sourceHandle}-{target}-{targetHandle}}.
     */
    public static String idFor(String source, String sourceHandle, String target, String targetHandle) {
        return "edge-" + source + "-" + sourceHandle + "-" + target + "-" + targetHandle;
    }

    public boolean isTransport() {
        return medium.isTransport();
    }

    public boolean isSelfLoop() {
        return source.equals(target);
    }

    /**
     * Whether either endpoint belongs to the given instrument.
     */
    public boolean touches(String instrumentId) {
        return source.equals(instrumentId) || target.equals(instrumentId);
    }

    /**
     * Returns a copy with new handles and a re-derived id.
     */
    public Connection withHandles(String newSourceHandle, String newTargetHandle) {
        return of(source, newSourceHandle, target, newTargetHandle, medium);
    }
}
