package io.studiograph.core.model;

import java.util.ArrayList;
import java.util.List;
import lombok.experimental.UtilityClass;

/**
 * Edits on 1-based slot lists that keep the numbering contiguous.
 * <p>
 * Every method returns a new immutable list; the input is never modified.
 * </p>
 */
@UtilityClass
public class SlotLists {

    /**
     * Appends an entry numbered {@code size + 1}.
     *
     * @throws SlotCapacityException if the list already holds {@code capacity} entries
     */
    public static <T extends Slotted<T>> List<T> append(List<T> entries, T entry, int capacity, String listName) {
        if (entries.size() >= capacity) {
            throw new SlotCapacityException(listName, capacity);
        }
        List<T> result = new ArrayList<>(entries);
        result.add(entry.withSlot(entries.size() + 1));
        return List.copyOf(result);
    }

    /**
     * Replaces the entry at {@code slot}, keeping its slot number.
     * An unknown slot leaves the list unchanged.
     */
    public static <T extends Slotted<T>> List<T> replace(List<T> entries, int slot, T entry) {
        List<T> result = new ArrayList<>(entries.size());
        for (T existing : entries) {
            result.add(existing.slot() == slot ? entry.withSlot(slot) : existing);
        }
        return List.copyOf(result);
    }

    /**
     * Removes the entry at {@code slot} and renumbers the rest 1..N.
     */
    public static <T extends Slotted<T>> List<T> remove(List<T> entries, int slot) {
        List<T> result = new ArrayList<>(entries);
        result.removeIf(existing -> existing.slot() == slot);
        return renumber(result);
    }

    /**
     * Swaps the entry at {@code slot} with its neighbour in {@code direction} and
     * renumbers 1..N. A move past either end, or an unknown slot, leaves the list
     * unchanged.
     */
    public static <T extends Slotted<T>> List<T> move(List<T> entries, int slot, SlotDirection direction) {
        int index = -1;
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).slot() == slot) {
                index = i;
                break;
            }
        }
        int other = index + direction.offset();
        if (index < 0 || other < 0 || other >= entries.size()) {
            return List.copyOf(entries);
        }
        List<T> result = new ArrayList<>(entries);
        T moving = result.get(index);
        result.set(index, result.get(other));
        result.set(other, moving);
        return renumber(result);
    }

    public static <T extends Slotted<T>> List<T> renumber(List<T> entries) {
        List<T> result = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            result.add(entries.get(i).withSlot(i + 1));
        }
        return List.copyOf(result);
    }
}
