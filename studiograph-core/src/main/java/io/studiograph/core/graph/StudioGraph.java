package io.studiograph.core.graph;

import io.studiograph.core.model.AssignSlot;
import io.studiograph.core.model.AutomationLane;
import io.studiograph.core.model.CcMapping;
import io.studiograph.core.model.Connection;
import io.studiograph.core.model.DrumLane;
import io.studiograph.core.model.Instrument;
import io.studiograph.core.model.InstrumentPreset;
import io.studiograph.core.model.InstrumentType;
import io.studiograph.core.model.NrpnMapping;
import io.studiograph.core.model.Port;
import io.studiograph.core.model.PortType;
import io.studiograph.core.model.Presets;
import io.studiograph.core.model.SlotDirection;
import io.studiograph.core.model.SlotLists;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The mutable studio graph: instruments, connections and user presets.
 * <p>
 * Owns the sequence used for new instrument ids ({@code node-1}, {@code node-2}, ...)
 * and re-runs {@link CycleDetector} after every mutation that can change
 * connectivity or local-off flags. Registered {@link LoopStatusListener}s are told
 * when the resulting {@link CycleReport} changes.
 * </p>
 * <p>
 * Queries return immutable snapshots. Mutations addressed to an unknown instrument
 * id are no-ops and return empty. Not thread-safe: callers confine a graph to one
 * thread.
 * </p>
 */
public class StudioGraph {
    private static final Logger logger = LoggerFactory.getLogger(StudioGraph.class);

    static final String INSTRUMENT_ID_PREFIX = "node-";
    private static final Pattern SEQUENCED_ID = Pattern.compile("^node-(\\d+)$");

    private final List<Instrument> instruments = new ArrayList<>();
    private final List<Connection> connections = new ArrayList<>();
    private final List<InstrumentPreset> customPresets = new ArrayList<>();
    private final List<LoopStatusListener> listeners = new CopyOnWriteArrayList<>();

    private int instrumentSequence;
    private CycleReport loopStatus = CycleReport.none();

    /**
     * Creates a studio holding only the hub instrument.
     */
    public StudioGraph() {
        instruments.add(Presets.hubInstrument());
    }

    // =========================================================================
    // Queries
    // =========================================================================

    public List<Instrument> instruments() {
        return List.copyOf(instruments);
    }

    public List<Connection> connections() {
        return List.copyOf(connections);
    }

    public List<InstrumentPreset> customPresets() {
        return List.copyOf(customPresets);
    }

    public Optional<Instrument> findInstrument(String id) {
        return instruments.stream().filter(instrument -> instrument.id().equals(id)).findFirst();
    }

    public Optional<Instrument> hub() {
        return instruments.stream().filter(Instrument::hub).findFirst();
    }

    public CycleReport loopStatus() {
        return loopStatus;
    }

    public boolean hasLoop() {
        return loopStatus.hasCycle();
    }

    /**
     * Pre-flight check for a connection from {@code source} to {@code target}.
     * Local-off flags are not consulted.
     */
    public boolean wouldCreateCycle(String source, String target) {
        return CycleDetector.wouldCreateCycle(connections, source, target);
    }

    // =========================================================================
    // Instruments
    // =========================================================================

    /**
     * Adds an instrument created from a preset.
     */
    public Instrument addInstrument(InstrumentPreset preset) {
        Objects.requireNonNull(preset, "preset cannot be null");
        Instrument instrument = preset.instantiate(nextInstrumentId());
        instruments.add(instrument);
        logger.debug("Added {} from preset {}", instrument.id(), preset.id());
        return instrument;
    }

    /**
     * Adds a POLY instrument built from imported catalog data.
     */
    public Instrument addInstrument(
        String name,
        String manufacturer,
        List<CcMapping> ccMap,
        List<NrpnMapping> nrpnMap,
        List<Port> inputs,
        List<Port> outputs
    ) {
        Instrument instrument = Instrument.builder()
            .id(nextInstrumentId())
            .name(name)
            .manufacturer(manufacturer)
            .channel(1)
            .type(InstrumentType.POLY)
            .inputs(inputs)
            .outputs(outputs)
            .ccMap(ccMap)
            .nrpnMap(nrpnMap)
            .removable(true)
            .build();
        instruments.add(instrument);
        logger.debug("Added {} ({} {})", instrument.id(), manufacturer, name);
        return instrument;
    }

    /**
     * Removes an instrument and every connection touching it.
     *
     * @return false when the instrument is unknown or not removable
     */
    public boolean removeInstrument(String id) {
        Optional<Instrument> existing = findInstrument(id);
        if (existing.isEmpty()) {
            return false;
        }
        if (!existing.get().removable()) {
            logger.warn("Refusing to remove non-removable instrument {}", id);
            return false;
        }

        instruments.remove(existing.get());
        connections.removeIf(connection -> connection.touches(id));
        refreshLoopStatus();
        return true;
    }

    /**
     * Replaces an instrument with the result of {@code update}. The id cannot change.
     */
    public Optional<Instrument> updateInstrument(String id, UnaryOperator<Instrument> update) {
        Objects.requireNonNull(update, "update cannot be null");
        int index = indexOf(id);
        if (index < 0) {
            return Optional.empty();
        }

        Instrument before = instruments.get(index);
        Instrument after = Objects.requireNonNull(update.apply(before), "update returned null");
        if (!after.id().equals(before.id())) {
            throw new IllegalArgumentException(
                "instrument id cannot change (" + before.id() + " -> " + after.id() + ")"
            );
        }

        instruments.set(index, after);
        if (before.localOff() != after.localOff()) {
            refreshLoopStatus();
        }
        return Optional.of(after);
    }

    public Optional<Instrument> setLocalOff(String id, boolean localOff) {
        return updateInstrument(id, instrument -> instrument.withLocalOff(localOff));
    }

    /**
     * Changes the track type. Switching to DRUM with no drum lanes fills in the default kit.
     */
    public Optional<Instrument> changeType(String id, InstrumentType type) {
        Objects.requireNonNull(type, "type cannot be null");
        return updateInstrument(id, instrument -> {
            Instrument.InstrumentBuilder builder = instrument.toBuilder().type(type);
            if (type == InstrumentType.DRUM && instrument.drumLanes().isEmpty()) {
                builder.drumLanes(Presets.DEFAULT_DRUM_LANES);
            }
            return builder.build();
        });
    }

    /**
     * Replaces an instrument's ports and drops connections that used a removed port.
     */
    public Optional<Instrument> updatePorts(String id, List<Port> inputs, List<Port> outputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        Objects.requireNonNull(outputs, "outputs cannot be null");
        Optional<Instrument> existing = findInstrument(id);
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        Set<String> removedPortIds = portIds(existing.get().inputs(), existing.get().outputs());
        removedPortIds.removeAll(portIds(inputs, outputs));

        Optional<Instrument> updated = updateInstrument(id, instrument -> instrument.withPorts(inputs, outputs));
        if (!removedPortIds.isEmpty()) {
            int before = connections.size();
            connections.removeIf(connection ->
                (connection.source().equals(id) && removedPortIds.contains(connection.sourceHandle()))
                    || (connection.target().equals(id) && removedPortIds.contains(connection.targetHandle())));
            logger.debug("Port update on {} removed {} connection(s)", id, before - connections.size());
        }
        refreshLoopStatus();
        return updated;
    }

    public Optional<Instrument> replaceControllerMaps(String id, List<CcMapping> ccMap, List<NrpnMapping> nrpnMap) {
        return updateInstrument(id, instrument -> instrument.toBuilder().ccMap(ccMap).nrpnMap(nrpnMap).build());
    }

    public Optional<Instrument> clearControllerMaps(String id) {
        return replaceControllerMaps(id, List.of(), List.of());
    }

    // =========================================================================
    // Connections
    // =========================================================================

    /**
     * Connects an output port to an input port.
     * <p>
     * Connecting the same four endpoints twice returns the existing connection.
     * Endpoints naming unknown instruments are ignored and yield empty.
     * </p>
     */
    public Optional<Connection> connect(
        String source,
        String sourceHandle,
        String target,
        String targetHandle,
        PortType medium
    ) {
        if (findInstrument(source).isEmpty() || findInstrument(target).isEmpty()) {
            logger.warn("Ignoring connection between unknown instruments {} -> {}", source, target);
            return Optional.empty();
        }

        Connection connection = Connection.of(source, sourceHandle, target, targetHandle, medium);
        Optional<Connection> existing = findConnection(connection.id());
        if (existing.isPresent()) {
            return existing;
        }

        connections.add(connection);
        refreshLoopStatus();
        return Optional.of(connection);
    }

    public boolean disconnect(String connectionId) {
        boolean removed = connections.removeIf(connection -> connection.id().equals(connectionId));
        if (removed) {
            refreshLoopStatus();
        }
        return removed;
    }

    public Optional<Connection> findConnection(String connectionId) {
        return connections.stream().filter(connection -> connection.id().equals(connectionId)).findFirst();
    }

    // =========================================================================
    // Slot lists
    // =========================================================================

    public Optional<Instrument> addAssignSlot(String id, AssignSlot slot) {
        return updateInstrument(id, instrument -> instrument.toBuilder()
            .assignSlots(SlotLists.append(instrument.assignSlots(), slot, AssignSlot.MAX_SLOTS, "Assign slots"))
            .build());
    }

    public Optional<Instrument> replaceAssignSlot(String id, int slot, AssignSlot replacement) {
        return updateInstrument(id, instrument -> instrument.toBuilder()
            .assignSlots(SlotLists.replace(instrument.assignSlots(), slot, replacement))
            .build());
    }

    public Optional<Instrument> removeAssignSlot(String id, int slot) {
        return updateInstrument(id, instrument -> instrument.toBuilder()
            .assignSlots(SlotLists.remove(instrument.assignSlots(), slot))
            .build());
    }

    public Optional<Instrument> moveAssignSlot(String id, int slot, SlotDirection direction) {
        return updateInstrument(id, instrument -> instrument.toBuilder()
            .assignSlots(SlotLists.move(instrument.assignSlots(), slot, direction))
            .build());
    }

    public Optional<Instrument> addAutomationLane(String id, AutomationLane lane) {
        return updateInstrument(id, instrument -> instrument.toBuilder()
            .automationLanes(SlotLists.append(
                instrument.automationLanes(), lane, AutomationLane.MAX_LANES, "Automation lanes"))
            .build());
    }

    public Optional<Instrument> replaceAutomationLane(String id, int slot, AutomationLane replacement) {
        return updateInstrument(id, instrument -> instrument.toBuilder()
            .automationLanes(SlotLists.replace(instrument.automationLanes(), slot, replacement))
            .build());
    }

    public Optional<Instrument> removeAutomationLane(String id, int slot) {
        return updateInstrument(id, instrument -> instrument.toBuilder()
            .automationLanes(SlotLists.remove(instrument.automationLanes(), slot))
            .build());
    }

    public Optional<Instrument> moveAutomationLane(String id, int slot, SlotDirection direction) {
        return updateInstrument(id, instrument -> instrument.toBuilder()
            .automationLanes(SlotLists.move(instrument.automationLanes(), slot, direction))
            .build());
    }

    public Optional<Instrument> addDrumLane(String id, DrumLane lane) {
        return updateInstrument(id, instrument -> instrument.toBuilder()
            .drumLanes(SlotLists.append(instrument.drumLanes(), lane, DrumLane.MAX_LANES, "Drum lanes"))
            .build());
    }

    public Optional<Instrument> replaceDrumLane(String id, int lane, DrumLane replacement) {
        return updateInstrument(id, instrument -> instrument.toBuilder()
            .drumLanes(SlotLists.replace(instrument.drumLanes(), lane, replacement))
            .build());
    }

    public Optional<Instrument> removeDrumLane(String id, int lane) {
        return updateInstrument(id, instrument -> instrument.toBuilder()
            .drumLanes(SlotLists.remove(instrument.drumLanes(), lane))
            .build());
    }

    public Optional<Instrument> moveDrumLane(String id, int lane, SlotDirection direction) {
        return updateInstrument(id, instrument -> instrument.toBuilder()
            .drumLanes(SlotLists.move(instrument.drumLanes(), lane, direction))
            .build());
    }

    // =========================================================================
    // Presets
    // =========================================================================

    public void addCustomPreset(InstrumentPreset preset) {
        Objects.requireNonNull(preset, "preset cannot be null");
        customPresets.removeIf(existing -> existing.id().equals(preset.id()));
        customPresets.add(preset);
    }

    public boolean removeCustomPreset(String presetId) {
        return customPresets.removeIf(preset -> preset.id().equals(presetId));
    }

    // =========================================================================
    // Whole-graph operations
    // =========================================================================

    /**
     * Replaces the whole graph, typically with the contents of a save file.
     * <p>
     * The id sequence continues after the highest imported {@code node-N}. Custom
     * presets are replaced only when {@code presets} is non-empty.
     * </p>
     */
    public void importSnapshot(List<Instrument> newInstruments, List<Connection> newConnections, List<InstrumentPreset> presets) {
        Objects.requireNonNull(newInstruments, "newInstruments cannot be null");
        Objects.requireNonNull(newConnections, "newConnections cannot be null");

        instruments.clear();
        instruments.addAll(newInstruments);
        connections.clear();
        connections.addAll(newConnections);
        if (presets != null && !presets.isEmpty()) {
            customPresets.clear();
            customPresets.addAll(presets);
        }

        instrumentSequence = newInstruments.stream()
            .map(instrument -> SEQUENCED_ID.matcher(instrument.id()))
            .filter(Matcher::matches)
            .mapToInt(matcher -> Integer.parseInt(matcher.group(1)))
            .max()
            .orElse(0);

        logger.info("Imported studio: {} instrument(s), {} connection(s), {} custom preset(s)",
            instruments.size(), connections.size(), customPresets.size());
        refreshLoopStatus();
    }

    /**
     * Resets to a studio holding only the hub instrument.
     */
    public void clear() {
        instruments.clear();
        instruments.add(Presets.hubInstrument());
        connections.clear();
        customPresets.clear();
        instrumentSequence = 0;

        logger.info("Studio cleared");
        refreshLoopStatus();
    }

    // =========================================================================
    // Loop status
    // =========================================================================

    public void addLoopStatusListener(LoopStatusListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    public void removeLoopStatusListener(LoopStatusListener listener) {
        listeners.remove(listener);
    }

    private void refreshLoopStatus() {
        CycleReport report = CycleDetector.detect(instruments, connections);
        if (report.equals(loopStatus)) {
            return;
        }
        loopStatus = report;
        if (report.hasCycle()) {
            logger.debug("Feedback loop through {}", report.connectionIds());
        } else {
            logger.debug("Feedback loop cleared");
        }
        listeners.forEach(listener -> listener.loopStatusChanged(report));
    }

    private String nextInstrumentId() {
        return INSTRUMENT_ID_PREFIX + (++instrumentSequence);
    }

    private int indexOf(String id) {
        for (int i = 0; i < instruments.size(); i++) {
            if (instruments.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    private static Set<String> portIds(List<Port> inputs, List<Port> outputs) {
        Set<String> ids = new HashSet<>();
        inputs.forEach(port -> ids.add(port.id()));
        outputs.forEach(port -> ids.add(port.id()));
        return ids;
    }
}
