package io.studiograph.core.export;

import io.studiograph.core.model.Connection;
import io.studiograph.core.model.Instrument;
import io.studiograph.core.model.PortType;
import io.studiograph.core.routing.RoutingTracer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a traced graph into the list of tracks to export.
 *
 * <p>Resolution steps:
 * <ol>
 *   <li>Every (instrument, hub handle) pair from {@link RoutingTracer} is mapped to a
 *       {@link HubPort} code. Handles with no hub port are dropped.</li>
 *   <li>Direct CV connections from an analog hub output are added, unless the same
 *       (instrument, code) pair is already present.</li>
 *   <li>Per instrument, a {@code CV{n}} and a {@code G{n}} are merged into one
 *       {@code CVG{n}}. Unpaired CV and gate codes pass through.</li>
 * </ol>
 *
 * <p>Output order per instrument: transport codes first, then merged pairs, then
 * unpaired CV codes, then unpaired gate codes. Instruments appear in the order they
 * were first reached.
 */
public final class ConnectionResolver {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionResolver.class);

    private ConnectionResolver() {
    }

    /**
     * Traces and resolves the graph.
     */
    public static List<ResolvedRoute> resolve(List<Instrument> instruments, List<Connection> connections) {
        return resolve(instruments, connections, RoutingTracer.trace(instruments, connections));
    }

    /**
     * Resolves a graph against an existing trace.
     *
     * @param instruments graph nodes
     * @param connections graph edges
     * @param trace result of {@link RoutingTracer#trace} for the same graph
     * @return tracks to export; empty when the graph has no hub
     */
    public static List<ResolvedRoute> resolve(
        List<Instrument> instruments,
        List<Connection> connections,
        Map<String, Set<String>> trace
    ) {
        Objects.requireNonNull(instruments, "instruments cannot be null");
        Objects.requireNonNull(connections, "connections cannot be null");
        Objects.requireNonNull(trace, "trace cannot be null");

        Optional<Instrument> hub = RoutingTracer.findHub(instruments);
        if (hub.isEmpty()) {
            return List.of();
        }
        String hubId = hub.get().id();
        Map<String, Instrument> byId = instruments.stream()
            .collect(Collectors.toMap(Instrument::id, Function.identity(), (first, second) -> first, LinkedHashMap::new));

        Map<String, Set<ResolvedRoute>> grouped = new LinkedHashMap<>();

        trace.forEach((instrumentId, handles) -> {
            Instrument target = byId.get(instrumentId);
            if (target == null || target.hub()) {
                return;
            }
            for (String handle : handles) {
                Optional<HubPort> port = HubPort.fromHandle(handle);
                if (port.isEmpty()) {
                    logger.debug("Dropping unknown hub handle '{}' for {}", handle, instrumentId);
                    continue;
                }
                add(grouped, new ResolvedRoute(target, port.get().code(), port.get().isAnalog()));
            }
        });

        for (Connection connection : connections) {
            if (!connection.source().equals(hubId) || connection.medium() != PortType.CV) {
                continue;
            }
            Optional<HubPort> port = HubPort.fromHandle(connection.sourceHandle()).filter(HubPort::isAnalog);
            Instrument target = byId.get(connection.target());
            if (port.isEmpty() || target == null || target.hub()) {
                continue;
            }
            add(grouped, new ResolvedRoute(target, port.get().code(), true));
        }

        List<ResolvedRoute> resolved = new ArrayList<>();
        grouped.values().forEach(routes -> resolved.addAll(pairCvAndGate(routes)));
        logger.debug("Resolved {} route(s) across {} instrument(s)", resolved.size(), grouped.size());
        return List.copyOf(resolved);
    }

    private static void add(Map<String, Set<ResolvedRoute>> grouped, ResolvedRoute route) {
        grouped.computeIfAbsent(route.instrumentId(), key -> new LinkedHashSet<>()).add(route);
    }

    private static List<ResolvedRoute> pairCvAndGate(Set<ResolvedRoute> routes) {
        List<ResolvedRoute> others = new ArrayList<>();
        Map<String, ResolvedRoute> cvByChannel = new LinkedHashMap<>();
        Map<String, ResolvedRoute> gateByChannel = new LinkedHashMap<>();

        for (ResolvedRoute route : routes) {
            Optional<String> cv = HubPort.cvChannel(route.hubPortCode());
            Optional<String> gate = HubPort.gateChannel(route.hubPortCode());
            if (cv.isPresent()) {
                cvByChannel.putIfAbsent(cv.get(), route);
            } else if (gate.isPresent()) {
                gateByChannel.putIfAbsent(gate.get(), route);
            } else {
                others.add(route);
            }
        }

        List<ResolvedRoute> result = new ArrayList<>(others);
        List<ResolvedRoute> unpairedCv = new ArrayList<>();
        Set<String> pairedGates = new LinkedHashSet<>();

        cvByChannel.forEach((channel, cv) -> {
            if (gateByChannel.containsKey(channel)) {
                result.add(new ResolvedRoute(cv.instrument(), HubPort.combinedCode(channel), true));
                pairedGates.add(channel);
            } else {
                unpairedCv.add(cv);
            }
        });
        result.addAll(unpairedCv);
        gateByChannel.forEach((channel, gate) -> {
            if (!pairedGates.contains(channel)) {
                result.add(gate);
            }
        });
        return result;
    }
}
