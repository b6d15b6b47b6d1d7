package io.studiograph.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.Builder;

/**
 * A device in the studio graph.
 * <p>
 * Exactly one instrument in a graph is the hub (the sequencer whose outputs are
 * traced on export); it is created non-removable. An instrument with
 * {@code localOff} set does not echo incoming MIDI, so a loop through it is not
 * reported as feedback.
 * </p>
 * <p>
 * Lists are never null; absent lists are normalized to empty immutable lists.
 * Use {@link #toBuilder()} to derive modified copies.
 * </p>
 */
@Builder(toBuilder = true)
public record Instrument(
    String id,
    String name,
    String manufacturer,
    int channel,
    InstrumentType type,
    List<Port> inputs,
    List<Port> outputs,
    List<CcMapping> ccMap,
    List<NrpnMapping> nrpnMap,
    List<AssignSlot> assignSlots,
    List<AutomationLane> automationLanes,
    List<DrumLane> drumLanes,
    boolean hub,
    boolean removable,
    boolean localOff,
    boolean showCvPorts,
    String iconId,
    String presetId
) {
    public Instrument {
        Objects.requireNonNull(id, "id cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
        Objects.requireNonNull(name, "name cannot be null");
        manufacturer = manufacturer == null ? "" : manufacturer;
        if (channel < 1 || channel > 16) {
            throw new IllegalArgumentException("channel must be in range [1, 16], got: " + channel);
        }
        type = type == null ? InstrumentType.POLY : type;
        inputs = copyOrEmpty(inputs);
        outputs = copyOrEmpty(outputs);
        ccMap = copyOrEmpty(ccMap);
        nrpnMap = copyOrEmpty(nrpnMap);
        assignSlots = copyOrEmpty(assignSlots);
        automationLanes = copyOrEmpty(automationLanes);
        drumLanes = copyOrEmpty(drumLanes);
    }

    private static <T> List<T> copyOrEmpty(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    public Optional<Port> findInput(String portId) {
        return inputs.stream().filter(port -> port.id().equals(portId)).findFirst();
    }

    public Optional<Port> findOutput(String portId) {
        return outputs.stream().filter(port -> port.id().equals(portId)).findFirst();
    }

    public boolean isDrum() {
        return type == InstrumentType.DRUM;
    }

    public Instrument withLocalOff(boolean newLocalOff) {
        return toBuilder().localOff(newLocalOff).build();
    }

    public Instrument withPorts(List<Port> newInputs, List<Port> newOutputs) {
        return toBuilder().inputs(newInputs).outputs(newOutputs).build();
    }
}
