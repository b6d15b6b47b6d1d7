package io.studiograph.core.model;

import java.util.Objects;

/**
 * An automation lane of a hub track.
 * <p>
 * Only the payload fields that belong to the lane's {@link AutomationType} are
 * meaningful: the controller number for {@code CC}, the CV output (1-4) for
 * {@code CV}, and MSB, LSB and depth (7 or 14 bits) for {@code NRPN}.
 * {@code PB} and {@code AT} carry no payload. Unused fields are null.
 * </p>
 */
public record AutomationLane(
    int slot,
    AutomationType type,
    Integer ccNumber,
    Integer cvNumber,
    Integer nrpnMsb,
    Integer nrpnLsb,
    Integer nrpnDepth
) implements Slotted<AutomationLane> {

    public static final int MAX_LANES = 64;

    public AutomationLane {
        MidiValues.requireSlot(slot, "slot");
        Objects.requireNonNull(type, "type cannot be null");
        MidiValues.requireSevenBitOrNull(ccNumber, "ccNumber");
        MidiValues.requireSevenBitOrNull(nrpnMsb, "nrpnMsb");
        MidiValues.requireSevenBitOrNull(nrpnLsb, "nrpnLsb");
        if (cvNumber != null && (cvNumber < 1 || cvNumber > 4)) {
            throw new IllegalArgumentException("cvNumber must be in range [1, 4], got: " + cvNumber);
        }
        if (nrpnDepth != null && nrpnDepth != 7 && nrpnDepth != 14) {
            throw new IllegalArgumentException("nrpnDepth must be 7 or 14, got: " + nrpnDepth);
        }
    }

    public static AutomationLane cc(int slot, int ccNumber) {
        return new AutomationLane(slot, AutomationType.CC, ccNumber, null, null, null, null);
    }

    public static AutomationLane pitchBend(int slot) {
        return new AutomationLane(slot, AutomationType.PB, null, null, null, null, null);
    }

    public static AutomationLane aftertouch(int slot) {
        return new AutomationLane(slot, AutomationType.AT, null, null, null, null, null);
    }

    public static AutomationLane cv(int slot, int cvNumber) {
        return new AutomationLane(slot, AutomationType.CV, null, cvNumber, null, null, null);
    }

    public static AutomationLane nrpn(int slot, int msb, int lsb, int depth) {
        return new AutomationLane(slot, AutomationType.NRPN, null, null, msb, lsb, depth);
    }

    @Override
    public AutomationLane withSlot(int newSlot) {
        return new AutomationLane(newSlot, type, ccNumber, cvNumber, nrpnMsb, nrpnLsb, nrpnDepth);
    }
}
