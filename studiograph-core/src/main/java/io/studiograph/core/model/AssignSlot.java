package io.studiograph.core.model;

import java.util.Objects;

/**
 * One of the eight controllers bound to the hub's assign encoders.
 */
public record AssignSlot(
    int slot,
    int ccNumber,
    String paramName,
    int defaultValue
) implements Slotted<AssignSlot> {

    public static final int MAX_SLOTS = 8;

    public AssignSlot {
        MidiValues.requireSlot(slot, "slot");
        MidiValues.requireSevenBit(ccNumber, "ccNumber");
        Objects.requireNonNull(paramName, "paramName cannot be null");
    }

    @Override
    public AssignSlot withSlot(int newSlot) {
        return new AssignSlot(newSlot, ccNumber, paramName, defaultValue);
    }
}
