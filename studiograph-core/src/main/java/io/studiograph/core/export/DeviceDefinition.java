package io.studiograph.core.export;

import io.studiograph.core.model.AssignSlot;
import io.studiograph.core.model.AutomationLane;
import io.studiograph.core.model.CcMapping;
import io.studiograph.core.model.DrumLane;
import io.studiograph.core.model.Instrument;
import io.studiograph.core.model.InstrumentType;
import io.studiograph.core.model.NrpnMapping;
import java.util.List;
import java.util.Objects;

/**
 * Everything written into one hub definition file.
 *
 * @param outChannel MIDI channel for {@code OUTCHAN}, or null for analog routes
 */
public record DeviceDefinition(
    String name,
    String manufacturer,
    String trackName,
    InstrumentType type,
    String outPort,
    Integer outChannel,
    List<CcMapping> ccMappings,
    List<NrpnMapping> nrpnMappings,
    List<AssignSlot> assignSlots,
    List<AutomationLane> automationLanes,
    List<DrumLane> drumLanes
) {
    public DeviceDefinition {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(manufacturer, "manufacturer cannot be null");
        Objects.requireNonNull(trackName, "trackName cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(outPort, "outPort cannot be null");
        ccMappings = ccMappings == null ? List.of() : List.copyOf(ccMappings);
        nrpnMappings = nrpnMappings == null ? List.of() : List.copyOf(nrpnMappings);
        assignSlots = assignSlots == null ? List.of() : List.copyOf(assignSlots);
        automationLanes = automationLanes == null ? List.of() : List.copyOf(automationLanes);
        drumLanes = drumLanes == null ? List.of() : List.copyOf(drumLanes);
    }

    /**
     * Builds the definition of an instrument exported on {@code hubPortCode}.
     */
    public static DeviceDefinition of(Instrument instrument, String trackName, String hubPortCode, boolean analog) {
        return new DeviceDefinition(
            instrument.name(),
            instrument.manufacturer(),
            trackName,
            instrument.type(),
            hubPortCode,
            analog ? null : instrument.channel(),
            instrument.ccMap(),
            instrument.nrpnMap(),
            instrument.assignSlots(),
            instrument.automationLanes(),
            instrument.drumLanes()
        );
    }
}
