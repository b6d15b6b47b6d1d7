package io.studiograph.core.export;

import io.studiograph.core.model.Instrument;
import java.util.Objects;

/**
 * One exported track: an instrument driven from a hub output.
 *
 * @param instrument the downstream instrument
 * @param hubPortCode {@code OUTPORT} code, e.g. {@code A}, {@code USBH}, {@code CV1}, {@code CVG2}
 * @param analog whether the route is CV or gate rather than MIDI
 */
public record ResolvedRoute(
    Instrument instrument,
    String hubPortCode,
    boolean analog
) {
    public ResolvedRoute {
        Objects.requireNonNull(instrument, "instrument cannot be null");
        Objects.requireNonNull(hubPortCode, "hubPortCode cannot be null");
    }

    public String instrumentId() {
        return instrument.id();
    }
}
