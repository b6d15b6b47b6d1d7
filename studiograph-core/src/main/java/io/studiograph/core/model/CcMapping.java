package io.studiograph.core.model;

import java.util.Objects;

/**
 * A MIDI continuous-controller parameter of an instrument.
 *
 * @param ccNumber controller number (0-127)
 * @param paramName cleaned short name, at most twelve characters
 * @param fullParamName original catalog name, may be null
 * @param section grouping section, may be null
 * @param defaultValue default value, may be null
 */
public record CcMapping(
    int ccNumber,
    String paramName,
    String fullParamName,
    String section,
    Integer defaultValue
) {
    public CcMapping {
        MidiValues.requireSevenBit(ccNumber, "ccNumber");
        Objects.requireNonNull(paramName, "paramName cannot be null");
    }

    /**
     * Builds a mapping from a raw catalog parameter name, keeping the raw name as
     * {@link #fullParamName()} and a cleaned name as {@link #paramName()}.
     */
    public static CcMapping of(int ccNumber, String rawName, String section, Integer defaultValue) {
        return new CcMapping(ccNumber, ParamNames.clean(rawName), rawName, section, defaultValue);
    }
}
