package io.studiograph.core.model;

import java.util.regex.Pattern;

/**
 * A row of a DRUM track.
 * <p>
 * {@code chan} selects the output for the row and is one of:
 * <ul>
 *   <li>a MIDI channel {@code "1"}..{@code "16"}</li>
 *   <li>a gate output {@code "G1"}..{@code "G4"}</li>
 *   <li>a CV output {@code "CV1"}..{@code "CV4"}</li>
 *   <li>a CV and gate pair {@code "CVG1"}..{@code "CVG4"}</li>
 * </ul>
 * A null {@code trig}, {@code chan} or {@code note} means the hub's own default.
 */
public record DrumLane(
    int lane,
    Integer trig,
    String chan,
    Integer note,
    String name
) implements Slotted<DrumLane> {

    public static final int MAX_LANES = 8;

    private static final Pattern CHANNEL_CODE =
        Pattern.compile("(?:[1-9]|1[0-6])|(?:G|CV|CVG)[1-4]");

    public DrumLane {
        MidiValues.requireSlot(lane, "lane");
        MidiValues.requireSevenBitOrNull(trig, "trig");
        MidiValues.requireSevenBitOrNull(note, "note");
        if (chan != null && chan.isBlank()) {
            chan = null;
        }
        if (chan != null && !CHANNEL_CODE.matcher(chan).matches()) {
            throw new IllegalArgumentException(
                "chan must be 1-16, G1-G4, CV1-CV4 or CVG1-CVG4, got: " + chan
            );
        }
        name = name == null ? "" : name;
    }

    public static DrumLane of(int lane, Integer note, String name) {
        return new DrumLane(lane, null, null, note, name);
    }

    /**
     * Clamps a trigger value into 0-127; null stays null.
     */
    public static Integer clampTrig(Integer trig) {
        if (trig == null) {
            return null;
        }
        return Math.max(0, Math.min(127, trig));
    }

    @Override
    public int slot() {
        return lane;
    }

    @Override
    public DrumLane withSlot(int newSlot) {
        return new DrumLane(newSlot, trig, chan, note, name);
    }
}
