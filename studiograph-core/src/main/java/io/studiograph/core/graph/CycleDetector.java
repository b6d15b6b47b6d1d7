package io.studiograph.core.graph;

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
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feedback-loop detection over the connection graph.
 *
 * <p>{@link #detect} runs a depth-first search from every unvisited instrument in
 * declaration order, following outgoing connections in connection order. The first
 * back-edge to an instrument on the current path closes a loop; the loop is traced
 * back through the DFS parents to that instrument. If any instrument on the loop has
 * local-off set, the scan reports no loop at all.
 *
 * <p>{@link #wouldCreateCycle} is a pre-flight check for a single new connection.
 * It ignores local-off.
 *
 * <p>The search uses an explicit stack, so long chains cannot overflow the call stack.
 */
public final class CycleDetector {

    private static final Logger logger = LoggerFactory.getLogger(CycleDetector.class);

    private CycleDetector() {
    }

    /**
     * Scans the graph for a feedback loop.
     *
     * @param instruments graph nodes, in declaration order
     * @param connections graph edges; connections naming unknown instruments are ignored
     * @return the first loop found, or {@link CycleReport#none()}
     */
    public static CycleReport detect(List<Instrument> instruments, List<Connection> connections) {
        Objects.requireNonNull(instruments, "instruments cannot be null");
        Objects.requireNonNull(connections, "connections cannot be null");

        Map<String, Instrument> byId = new LinkedHashMap<>();
        Map<String, List<Connection>> adjacency = new HashMap<>();
        for (Instrument instrument : instruments) {
            byId.put(instrument.id(), instrument);
            adjacency.put(instrument.id(), new ArrayList<>());
        }
        for (Connection connection : connections) {
            if (byId.containsKey(connection.source()) && byId.containsKey(connection.target())) {
                adjacency.get(connection.source()).add(connection);
            }
        }

        Set<String> visited = new HashSet<>();
        for (String root : byId.keySet()) {
            if (visited.contains(root)) {
                continue;
            }
            CycleReport found = search(root, adjacency, visited);
            if (found == null) {
                continue;
            }

            for (String instrumentId : found.instrumentIds()) {
                if (byId.get(instrumentId).localOff()) {
                    logger.debug("Loop through {} suppressed by local-off on {}",
                        found.instrumentIds(), instrumentId);
                    return CycleReport.none();
                }
            }
            logger.debug("Feedback loop found: {}", found.connectionIds());
            return found;
        }
        return CycleReport.none();
    }

    /**
     * Checks whether connecting {@code source} to {@code target} would close a loop,
     * that is whether {@code target} already reaches {@code source} or both are the
     * same instrument. Local-off flags are not consulted.
     */
    public static boolean wouldCreateCycle(List<Connection> connections, String source, String target) {
        Objects.requireNonNull(connections, "connections cannot be null");
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(target, "target cannot be null");

        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(target);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(source)) {
                return true;
            }
            if (!visited.add(current)) {
                continue;
            }
            for (Connection connection : connections) {
                if (connection.source().equals(current) && !visited.contains(connection.target())) {
                    queue.add(connection.target());
                }
            }
        }
        return false;
    }

    /**
     * Depth-first search from one root. Returns the loop found, or null when the
     * subtree is acyclic.
     */
    private static CycleReport search(
        String root,
        Map<String, List<Connection>> adjacency,
        Set<String> visited
    ) {
        Set<String> onStack = new HashSet<>();
        Map<String, Connection> parentEdge = new HashMap<>();
        Deque<Frame> stack = new ArrayDeque<>();

        visited.add(root);
        onStack.add(root);
        stack.push(new Frame(root, adjacency.get(root)));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.hasNext()) {
                onStack.remove(frame.instrumentId);
                stack.pop();
                continue;
            }

            Connection connection = frame.next();
            String neighbor = connection.target();
            if (!visited.contains(neighbor)) {
                parentEdge.put(neighbor, connection);
                visited.add(neighbor);
                onStack.add(neighbor);
                stack.push(new Frame(neighbor, adjacency.get(neighbor)));
            } else if (onStack.contains(neighbor)) {
                return traceBack(connection, parentEdge);
            }
        }
        return null;
    }

    private static CycleReport traceBack(Connection closing, Map<String, Connection> parentEdge) {
        Set<String> loopConnections = new LinkedHashSet<>();
        List<String> loopInstruments = new ArrayList<>();
        String ancestor = closing.target();

        loopConnections.add(closing.id());
        loopInstruments.add(closing.source());

        String current = closing.source();
        while (!current.equals(ancestor)) {
            Connection parent = parentEdge.get(current);
            if (parent == null) {
                break;
            }
            loopConnections.add(parent.id());
            current = parent.source();
            loopInstruments.add(current);
        }
        if (!loopInstruments.contains(ancestor)) {
            loopInstruments.add(ancestor);
        }

        // signal-flow order, starting at the instrument the loop closes on
        Collections.reverse(loopInstruments);
        return CycleReport.of(loopConnections, loopInstruments);
    }

    private static final class Frame {
        private final String instrumentId;
        private final List<Connection> outgoing;
        private int next;

        private Frame(String instrumentId, List<Connection> outgoing) {
            this.instrumentId = instrumentId;
            this.outgoing = outgoing;
        }

        private boolean hasNext() {
            return next < outgoing.size();
        }

        private Connection next() {
            return outgoing.get(next++);
        }
    }
}
