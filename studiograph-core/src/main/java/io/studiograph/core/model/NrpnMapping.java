package io.studiograph.core.model;

import java.util.Objects;

/**
 * A non-registered parameter number of an instrument.
 */
public record NrpnMapping(
    int msb,
    int lsb,
    String paramName,
    String section,
    Integer defaultValue
) {
    public NrpnMapping {
        MidiValues.requireSevenBit(msb, "msb");
        MidiValues.requireSevenBit(lsb, "lsb");
        Objects.requireNonNull(paramName, "paramName cannot be null");
    }

    public static NrpnMapping of(int msb, int lsb, String rawName, String section, Integer defaultValue) {
        return new NrpnMapping(msb, lsb, ParamNames.clean(rawName), section, defaultValue);
    }
}
