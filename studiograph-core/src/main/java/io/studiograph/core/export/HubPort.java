package io.studiograph.core.export;

import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Hapax output jacks and the port codes written on the {@code OUTPORT} line.
 */
public enum HubPort {
    MIDI_A("midi-a", "A", false),
    MIDI_B("midi-b", "B", false),
    MIDI_C("midi-c", "C", false),
    MIDI_D("midi-d", "D", false),
    USB_HOST("usb-host", "USBH", false),
    USB_DEVICE("usb-device", "USBD", false),
    CV_1("cv-1", "CV1", true),
    CV_2("cv-2", "CV2", true),
    CV_3("cv-3", "CV3", true),
    CV_4("cv-4", "CV4", true),
    GATE_1("gate-1", "G1", true),
    GATE_2("gate-2", "G2", true),
    GATE_3("gate-3", "G3", true),
    GATE_4("gate-4", "G4", true);

    private static final Pattern CV_CODE = Pattern.compile("CV(\\d)");
    private static final Pattern GATE_CODE = Pattern.compile("G(\\d)");

    private final String handle;
    private final String code;
    private final boolean analog;

    HubPort(String handle, String code, boolean analog) {
        this.handle = handle;
        this.code = code;
        this.analog = analog;
    }

    /**
     * Output port id on the hub instrument.
     */
    public String handle() {
        return handle;
    }

    public String code() {
        return code;
    }

    public boolean isAnalog() {
        return analog;
    }

    /**
     * Looks up a hub output by port id. Unknown ids yield empty.
     */
    public static Optional<HubPort> fromHandle(String handle) {
        return Arrays.stream(values()).filter(port -> port.handle.equals(handle)).findFirst();
    }

    /**
     * Channel number of a {@code CV{n}} code, or empty for any other code.
     */
    static Optional<String> cvChannel(String code) {
        return channel(CV_CODE, code);
    }

    /**
     * Channel number of a {@code G{n}} code, or empty for any other code.
     */
    static Optional<String> gateChannel(String code) {
        return channel(GATE_CODE, code);
    }

    /**
     * Code for a CV output paired with the gate of the same number.
     */
    static String combinedCode(String channel) {
        return "CVG" + channel;
    }

    private static Optional<String> channel(Pattern pattern, String code) {
        Matcher matcher = pattern.matcher(code);
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
