package io.studiograph.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.experimental.UtilityClass;

/**
 * Shortens catalog parameter names to fit the hub's twelve-character display.
 *
 * <p>Steps, in order:
 * <ol>
 *   <li>strip a leading {@code "Prefix:"} device prefix ({@code "Source: Tune"} becomes {@code "Tune"})</li>
 *   <li>abbreviate common synthesis words ({@code Envelope} to {@code Env}, {@code Filter} to {@code Flt}, ...)</li>
 *   <li>remove all whitespace</li>
 *   <li>truncate to twelve characters</li>
 * </ol>
 * A null, empty or fully stripped name becomes {@code "Unknown"}.
 */
@UtilityClass
public class ParamNames {

    public static final int MAX_LENGTH = 12;
    public static final String UNKNOWN = "Unknown";

    private static final Pattern DEVICE_PREFIX = Pattern.compile("^[^:]+:\\s*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<String, String> ABBREVIATIONS = new LinkedHashMap<>();

    static {
        ABBREVIATIONS.put("Envelope", "Env");
        ABBREVIATIONS.put("Oscillator", "Osc");
        ABBREVIATIONS.put("Parameter", "Param");
        ABBREVIATIONS.put("Modulation", "Mod");
        ABBREVIATIONS.put("Frequency", "Freq");
        ABBREVIATIONS.put("Resonance", "Reso");
        ABBREVIATIONS.put("Filter", "Flt");
        ABBREVIATIONS.put("Attack", "Atk");
        ABBREVIATIONS.put("Decay", "Dcy");
        ABBREVIATIONS.put("Sustain", "Sus");
        ABBREVIATIONS.put("Release", "Rel");
        ABBREVIATIONS.put("Velocity", "Vel");
        ABBREVIATIONS.put("Level", "Lvl");
    }

    public static String clean(String rawName) {
        if (rawName == null || rawName.isEmpty()) {
            return UNKNOWN;
        }

        String cleaned = DEVICE_PREFIX.matcher(rawName).replaceFirst("");
        for (Map.Entry<String, String> abbreviation : ABBREVIATIONS.entrySet()) {
            cleaned = cleaned.replace(abbreviation.getKey(), abbreviation.getValue());
        }
        cleaned = WHITESPACE.matcher(cleaned).replaceAll("");

        if (cleaned.length() > MAX_LENGTH) {
            cleaned = cleaned.substring(0, MAX_LENGTH);
        }
        return cleaned.isEmpty() ? UNKNOWN : cleaned;
    }
}
