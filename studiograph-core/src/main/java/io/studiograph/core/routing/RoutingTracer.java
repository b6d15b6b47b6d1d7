package io.studiograph.core.routing;

import io.studiograph.core.model.Connection;
import io.studiograph.core.model.Instrument;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds which hub outputs reach each downstream instrument.
 *
 * <p>Breadth-first search from the hub over transport connections only (MIDI and
 * USB). Each queue entry carries the hub output handle it started from, and the
 * visited state is keyed by (instrument, handle), so two hub outputs converging on
 * the same instrument are both recorded. Connections back into the hub are never
 * followed, and the hub itself never appears in the result.
 *
 * <p>Example:
 * <pre>
 * hub --midi-a--&gt; thru box --&gt; synth
 * hub --midi-b--------------&gt; synth
 *
 * trace(...) = { thru box: [midi-a], synth: [midi-b, midi-a] }
 * </pre>
 */
public final class RoutingTracer {

    private static final Logger logger = LoggerFactory.getLogger(RoutingTracer.class);

    private RoutingTracer() {
    }

    /**
     * Returns the first instrument flagged as hub, if any.
     */
    public static Optional<Instrument> findHub(List<Instrument> instruments) {
        return instruments.stream().filter(Instrument::hub).findFirst();
    }

    /**
     * Traces hub output handles downstream.
     *
     * @param instruments graph nodes
     * @param connections graph edges; connections naming unknown instruments are ignored
     * @return instrument id to the hub handles reaching it, in discovery order;
     *         empty when there is no hub
     */
    public static Map<String, Set<String>> trace(List<Instrument> instruments, List<Connection> connections) {
        Objects.requireNonNull(instruments, "instruments cannot be null");
        Objects.requireNonNull(connections, "connections cannot be null");

        Optional<Instrument> hub = findHub(instruments);
        if (hub.isEmpty()) {
            logger.debug("No hub instrument in graph, nothing to trace");
            return Map.of();
        }
        String hubId = hub.get().id();

        Set<String> known = instruments.stream().map(Instrument::id).collect(Collectors.toSet());
        Map<String, List<Connection>> transport = new HashMap<>();
        for (Connection connection : connections) {
            if (connection.isTransport()
                && known.contains(connection.source())
                && known.contains(connection.target())) {
                transport.computeIfAbsent(connection.source(), key -> new ArrayList<>()).add(connection);
            }
        }

        Map<String, Set<String>> result = new LinkedHashMap<>();
        Map<String, Set<String>> queued = new HashMap<>();
        Deque<Reach> queue = new ArrayDeque<>();

        for (Connection connection : transport.getOrDefault(hubId, List.of())) {
            enqueue(new Reach(connection.target(), connection.sourceHandle()), hubId, queued, queue);
        }

        while (!queue.isEmpty()) {
            Reach reach = queue.poll();
            result.computeIfAbsent(reach.instrumentId(), key -> new LinkedHashSet<>()).add(reach.hubHandle());

            for (Connection connection : transport.getOrDefault(reach.instrumentId(), List.of())) {
                enqueue(new Reach(connection.target(), reach.hubHandle()), hubId, queued, queue);
            }
        }

        logger.debug("Traced {} hub handle(s) to {} instrument(s)",
            result.values().stream().mapToInt(Set::size).sum(), result.size());

        Map<String, Set<String>> frozen = new LinkedHashMap<>();
        result.forEach((id, handles) -> frozen.put(id, Collections.unmodifiableSet(handles)));
        return Collections.unmodifiableMap(frozen);
    }

    private static void enqueue(Reach reach, String hubId, Map<String, Set<String>> queued, Deque<Reach> queue) {
        if (reach.instrumentId().equals(hubId)) {
            return;
        }
        if (queued.computeIfAbsent(reach.instrumentId(), key -> new HashSet<>()).add(reach.hubHandle())) {
            queue.add(reach);
        }
    }

    private record Reach(String instrumentId, String hubHandle) {
    }
}
