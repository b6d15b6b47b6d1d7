package io.studiograph.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link SlotLists}.
 * <p>
 * Coverage:
 * - Append numbering and capacity
 * - Replace keeps the slot number
 * - Remove and move renumber 1..N
 * - Moves at either end and unknown slots are no-ops
 */
class SlotListsTest {

    private static final List<AssignSlot> THREE = List.of(
        new AssignSlot(1, 10, "One", 0),
        new AssignSlot(2, 20, "Two", 0),
        new AssignSlot(3, 30, "Three", 0));

    private static List<Integer> ccNumbers(List<AssignSlot> slots) {
        return slots.stream().map(AssignSlot::ccNumber).toList();
    }

    private static List<Integer> slotNumbers(List<AssignSlot> slots) {
        return slots.stream().map(AssignSlot::slot).toList();
    }

    @Test
    void append_numbersEntryAfterLast() {
        List<AssignSlot> result = SlotLists.append(THREE, new AssignSlot(7, 40, "Four", 0), 8, "Assign slots");

        assertThat(result).hasSize(4);
        assertThat(result.get(3).slot()).isEqualTo(4);
        assertThat(THREE).hasSize(3);
    }

    @Test
    void append_atCapacity_throws() {
        assertThatThrownBy(() -> SlotLists.append(THREE, new AssignSlot(1, 40, "Four", 0), 3, "Assign slots"))
            .isInstanceOf(SlotCapacityException.class)
            .hasMessage("Assign slots is full (max 3)")
            .satisfies(e -> assertThat(((SlotCapacityException) e).getCapacity()).isEqualTo(3));
    }

    @Test
    void replace_keepsSlotNumber() {
        List<AssignSlot> result = SlotLists.replace(THREE, 2, new AssignSlot(5, 99, "New", 1));

        assertThat(result.get(1)).isEqualTo(new AssignSlot(2, 99, "New", 1));
    }

    @Test
    void remove_renumbersRemainingEntries() {
        List<AssignSlot> result = SlotLists.remove(THREE, 1);

        assertThat(ccNumbers(result)).containsExactly(20, 30);
        assertThat(slotNumbers(result)).containsExactly(1, 2);
    }

    @Test
    void move_upAndDown_swapNeighbours() {
        assertThat(ccNumbers(SlotLists.move(THREE, 2, SlotDirection.UP))).containsExactly(20, 10, 30);
        assertThat(ccNumbers(SlotLists.move(THREE, 2, SlotDirection.DOWN))).containsExactly(10, 30, 20);
        assertThat(slotNumbers(SlotLists.move(THREE, 2, SlotDirection.DOWN))).containsExactly(1, 2, 3);
    }

    @Test
    void move_pastEitherEnd_isNoOp() {
        assertThat(SlotLists.move(THREE, 1, SlotDirection.UP)).isEqualTo(THREE);
        assertThat(SlotLists.move(THREE, 3, SlotDirection.DOWN)).isEqualTo(THREE);
    }

    @Test
    void move_unknownSlot_isNoOp() {
        assertThat(SlotLists.move(THREE, 9, SlotDirection.UP)).isEqualTo(THREE);
    }

    @Test
    void renumber_worksOnDrumLanes() {
        List<DrumLane> lanes = SlotLists.renumber(List.of(DrumLane.of(4, 36, "Kick"), DrumLane.of(7, 38, "Snare")));

        assertThat(lanes).extracting(DrumLane::lane).containsExactly(1, 2);
    }
}
