package io.studiograph.core.model;

import java.util.List;
import lombok.experimental.UtilityClass;

/**
 * Built-in presets and defaults.
 */
@UtilityClass
public class Presets {

    public static final String HAPAX_PRESET_ID = "hapax";
    public static final String HUB_INSTRUMENT_ID = "hapax-main";

    /**
     * Rows a track gets when it is switched to {@link InstrumentType#DRUM} without lanes.
     */
    public static final List<DrumLane> DEFAULT_DRUM_LANES = List.of(
        DrumLane.of(1, 0, "KICK"),
        DrumLane.of(2, 1, "RIM"),
        DrumLane.of(3, 2, "SNARE"),
        DrumLane.of(4, 3, "CLSD HH"),
        DrumLane.of(5, 4, "OPEN HH"),
        DrumLane.of(6, 5, "CLAP"),
        DrumLane.of(7, 6, "PERC 1"),
        DrumLane.of(8, 7, "PERC 2")
    );

    private static final InstrumentPreset HAPAX = new InstrumentPreset(
        HAPAX_PRESET_ID,
        "Hapax",
        "Squarp",
        InstrumentType.POLY,
        List.of(
            Port.of("midi-in-1", "MIDI In 1", PortType.MIDI),
            Port.of("midi-in-2", "MIDI In 2", PortType.MIDI),
            Port.of("cv-in-1", "CV In 1", PortType.CV),
            Port.of("cv-in-2", "CV In 2", PortType.CV)
        ),
        List.of(
            Port.of("midi-a", "MIDI A", PortType.MIDI),
            Port.of("midi-b", "MIDI B", PortType.MIDI),
            Port.of("midi-c", "MIDI C", PortType.MIDI),
            Port.of("midi-d", "MIDI D", PortType.MIDI),
            Port.of("usb-host", "USB Host", PortType.USB),
            Port.of("usb-device", "USB Device", PortType.USB),
            Port.of("cv-1", "CV 1", PortType.CV),
            Port.of("cv-2", "CV 2", PortType.CV),
            Port.of("cv-3", "CV 3", PortType.CV),
            Port.of("cv-4", "CV 4", PortType.CV),
            Port.of("gate-1", "Gate 1", PortType.CV),
            Port.of("gate-2", "Gate 2", PortType.CV),
            Port.of("gate-3", "Gate 3", PortType.CV),
            Port.of("gate-4", "Gate 4", PortType.CV)
        ),
        true,
        false,
        List.of(),
        null,
        List.of(),
        List.of()
    );

    /**
     * The Squarp Hapax hub preset.
     */
    public static InstrumentPreset hapax() {
        return HAPAX;
    }

    /**
     * The hub instrument every new studio starts with.
     */
    public static Instrument hubInstrument() {
        return HAPAX.instantiate(HUB_INSTRUMENT_ID);
    }
}
