package io.studiograph.core.model;

/**
 * An entry of a 1-based, contiguously numbered slot list.
 *
 * @param <T> the concrete entry type
 */
public interface Slotted<T extends Slotted<T>> {

    int slot();

    T withSlot(int slot);
}
