package io.studiograph.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Signal medium carried by a {@link Port} or a {@link Connection}.
 * <p>
 * {@link #MIDI} and {@link #USB} are transport media: a connection of either kind
 * forwards routing identity from the hub instrument to whatever is downstream.
 * {@link #AUDIO} and {@link #CV} terminate routing resolution.
 * </p>
 */
public enum PortType {
    /**
     * DIN or TRS MIDI
     */
    MIDI("midi", true),

    /**
     * USB MIDI, host or device side
     */
    USB("usb", true),

    /**
     * Line or instrument level audio
     */
    AUDIO("audio", false),

    /**
     * Analog control voltage or gate
     */
    CV("cv", false);

    private final String wireName;
    private final boolean transport;

    PortType(String wireName, boolean transport) {
        this.wireName = wireName;
        this.transport = transport;
    }

    /**
     * Lower-case name used in save files.
     */
    public String wireName() {
        return wireName;
    }

    public boolean isTransport() {
        return transport;
    }

    /**
     * Looks up a medium by its save-file name, case-insensitively.
     */
    public static Optional<PortType> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(type -> type.wireName.equalsIgnoreCase(wireName.trim()))
            .findFirst();
    }
}
