package io.studiograph.core;

import io.studiograph.core.model.Connection;
import io.studiograph.core.model.Instrument;
import io.studiograph.core.model.InstrumentType;
import io.studiograph.core.model.Port;
import io.studiograph.core.model.PortType;
import io.studiograph.core.model.Presets;
import java.util.List;

/**
 * Small graph builders shared by the core tests.
 */
public final class Fixtures {

    public static final String HUB = Presets.HUB_INSTRUMENT_ID;

    private Fixtures() {
    }

    public static Instrument hub() {
        return Presets.hubInstrument();
    }

    /**
     * A removable POLY instrument with generic MIDI, USB, CV and audio ports.
     */
    public static Instrument instrument(String id) {
        return instrument(id, id);
    }

    public static Instrument instrument(String id, String name) {
        return Instrument.builder()
            .id(id)
            .name(name)
            .manufacturer("Test")
            .channel(1)
            .type(InstrumentType.POLY)
            .inputs(List.of(
                Port.of("midi-in", "MIDI In", PortType.MIDI),
                Port.of("usb-device-1", "USB", PortType.USB),
                Port.of("cv-in", "CV In", PortType.CV),
                Port.of("gate-in", "Gate In", PortType.CV),
                Port.of("audio-in", "Audio In", PortType.AUDIO)))
            .outputs(List.of(
                Port.of("midi-out", "MIDI Out", PortType.MIDI),
                Port.of("midi-thru", "MIDI Thru", PortType.MIDI),
                Port.of("audio-out", "Audio Out", PortType.AUDIO)))
            .removable(true)
            .build();
    }

    public static Instrument localOff(String id) {
        return instrument(id).withLocalOff(true);
    }

    public static Connection midi(String source, String target) {
        return Connection.of(source, "midi-out", target, "midi-in", PortType.MIDI);
    }

    public static Connection fromHub(String hubHandle, String target, PortType medium) {
        String targetHandle = switch (medium) {
            case MIDI -> "midi-in";
            case USB -> "usb-device-1";
            case AUDIO -> "audio-in";
            case CV -> hubHandle.startsWith("gate") ? "gate-in" : "cv-in";
        };
        return Connection.of(HUB, hubHandle, target, targetHandle, medium);
    }
}
