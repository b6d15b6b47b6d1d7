package io.studiograph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A template instruments are created from.
 * <p>
 * Built-in presets live in {@link Presets}; users may save their own, which are
 * carried in the studio save file.
 * </p>
 */
public record InstrumentPreset(
    String id,
    String name,
    String manufacturer,
    InstrumentType type,
    List<Port> inputs,
    List<Port> outputs,
    boolean hub,
    boolean removable,
    List<DrumLane> defaultDrumLanes,
    String iconId,
    List<CcMapping> ccMap,
    List<NrpnMapping> nrpnMap
) {
    public InstrumentPreset {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(name, "name cannot be null");
        manufacturer = manufacturer == null ? "" : manufacturer;
        type = type == null ? InstrumentType.POLY : type;
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        defaultDrumLanes = defaultDrumLanes == null ? List.of() : List.copyOf(defaultDrumLanes);
        ccMap = ccMap == null ? List.of() : List.copyOf(ccMap);
        nrpnMap = nrpnMap == null ? List.of() : List.copyOf(nrpnMap);
    }

    /**
     * Creates an instrument on MIDI channel 1 from this preset.
     */
    public Instrument instantiate(String instrumentId) {
        return Instrument.builder()
            .id(instrumentId)
            .name(name)
            .manufacturer(manufacturer)
            .channel(1)
            .type(type)
            .inputs(inputs)
            .outputs(outputs)
            .ccMap(ccMap)
            .nrpnMap(nrpnMap)
            .drumLanes(defaultDrumLanes)
            .hub(hub)
            .removable(removable)
            .iconId(iconId)
            .presetId(id)
            .build();
    }
}
