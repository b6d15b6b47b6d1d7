package io.studiograph.core.graph;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Result of a feedback-loop scan.
 *
 * @param hasCycle whether an unsuppressed loop exists
 * @param connectionIds connections on the loop, in trace-back order; empty when there is no loop
 * @param instrumentIds instruments on the loop in signal-flow order, starting at the instrument
 *                      the loop closes on; empty when there is no loop
 */
public record CycleReport(
    boolean hasCycle,
    Set<String> connectionIds,
    List<String> instrumentIds
) {
    private static final CycleReport NONE = new CycleReport(false, Set.of(), List.of());

    public CycleReport {
        Objects.requireNonNull(connectionIds, "connectionIds cannot be null");
        Objects.requireNonNull(instrumentIds, "instrumentIds cannot be null");
        connectionIds = Collections.unmodifiableSet(new LinkedHashSet<>(connectionIds));
        instrumentIds = List.copyOf(instrumentIds);
    }

    public static CycleReport none() {
        return NONE;
    }

    public static CycleReport of(Set<String> connectionIds, List<String> instrumentIds) {
        return new CycleReport(true, connectionIds, instrumentIds);
    }

    public boolean contains(String connectionId) {
        return connectionIds.contains(connectionId);
    }
}
