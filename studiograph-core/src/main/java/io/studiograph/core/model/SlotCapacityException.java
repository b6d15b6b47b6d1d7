package io.studiograph.core.model;

/**
 * Thrown when an entry is added to a slot list that is already full.
 */
public class SlotCapacityException extends RuntimeException {

    private final int capacity;

    public SlotCapacityException(String listName, int capacity) {
        super(listName + " is full (max " + capacity + ")");
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
