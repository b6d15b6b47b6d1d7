package io.studiograph.core.model;

/**
 * Track type written to the hub definition file.
 */
public enum InstrumentType {
    /**
     * Polyphonic note track
     */
    POLY,

    /**
     * Drum track with up to eight lanes
     */
    DRUM,

    /**
     * MIDI Polyphonic Expression track
     */
    MPE
}
