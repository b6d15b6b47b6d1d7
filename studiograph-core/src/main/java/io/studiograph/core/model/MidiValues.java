package io.studiograph.core.model;

import lombok.experimental.UtilityClass;

/**
 * Range checks shared by the model records.
 */
@UtilityClass
class MidiValues {

    static int requireSevenBit(int value, String name) {
        if (value < 0 || value > 127) {
            throw new IllegalArgumentException(name + " must be in range [0, 127], got: " + value);
        }
        return value;
    }

    static Integer requireSevenBitOrNull(Integer value, String name) {
        return value == null ? null : requireSevenBit(value, name);
    }

    static int requireSlot(int slot, String name) {
        if (slot < 1) {
            throw new IllegalArgumentException(name + " must be >= 1, got: " + slot);
        }
        return slot;
    }
}
