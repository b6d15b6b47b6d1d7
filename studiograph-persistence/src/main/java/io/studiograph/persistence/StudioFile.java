package io.studiograph.persistence;

import io.studiograph.core.graph.StudioGraph;
import io.studiograph.core.model.Connection;
import io.studiograph.core.model.Instrument;
import io.studiograph.core.model.InstrumentPreset;
import java.time.Instant;
import java.util.List;

/**
 * Contents of a studio save file.
 *
 * <p>JSON envelope (version 1):
 * <pre>
 * {
 *   "version": 1,
 *   "exportedAt": "2025-01-01T00:00:00Z",
 *   "instruments": [ ... ],
 *   "connections": [ ... ],
 *   "presets": [ ... ]
 * }
 * </pre>
 *
 * @param exportedAt ISO-8601 timestamp, empty when the file carried none
 * @param presets user presets saved alongside the graph
 */
public record StudioFile(
    int version,
    String exportedAt,
    List<Instrument> instruments,
    List<Connection> connections,
    List<InstrumentPreset> presets
) {
    public static final int CURRENT_VERSION = 1;

    public StudioFile {
        exportedAt = exportedAt == null ? "" : exportedAt;
        instruments = instruments == null ? List.of() : List.copyOf(instruments);
        connections = connections == null ? List.of() : List.copyOf(connections);
        presets = presets == null ? List.of() : List.copyOf(presets);
    }

    /**
     * Captures the current state of a graph, stamped with the current time.
     */
    public static StudioFile snapshot(StudioGraph graph) {
        return new StudioFile(
            CURRENT_VERSION,
            Instant.now().toString(),
            graph.instruments(),
            graph.connections(),
            graph.customPresets()
        );
    }

    /**
     * Replaces the contents of {@code graph} with this file.
     */
    public void applyTo(StudioGraph graph) {
        graph.importSnapshot(instruments, connections, presets);
    }
}
