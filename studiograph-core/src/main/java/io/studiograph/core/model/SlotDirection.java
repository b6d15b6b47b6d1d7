package io.studiograph.core.model;

/**
 * Direction a slot entry moves in its list.
 */
public enum SlotDirection {
    UP(-1),
    DOWN(1);

    private final int offset;

    SlotDirection(int offset) {
        this.offset = offset;
    }

    int offset() {
        return offset;
    }
}
