package io.studiograph.core.export;

import java.util.regex.Pattern;
import lombok.experimental.UtilityClass;

/**
 * Track name and file name derivation.
 * <p>
 * An instrument exported on more than one hub port gets a {@code _{code}} suffix on
 * both names so its files and tracks stay distinct. The suffix is added before the
 * track name is truncated.
 * </p>
 */
@UtilityClass
public class TrackNames {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NOT_ALPHANUMERIC = Pattern.compile("[^a-zA-Z0-9]");

    /**
     * {@code "Very Long Synth Name"} becomes {@code "VeryLongSynt"} at twelve characters.
     */
    public static String trackName(String instrumentName, String hubPortCode, boolean multiple, int maxLength) {
        String base = WHITESPACE.matcher(instrumentName).replaceAll("");
        String name = multiple ? base + "_" + hubPortCode : base;
        return name.length() > maxLength ? name.substring(0, maxLength) : name;
    }

    /**
     * {@code "My Synth! #2"} becomes {@code "My_Synth___2.txt"}.
     */
    public static String filename(String instrumentName, String hubPortCode, boolean multiple, String extension) {
        String sanitized = NOT_ALPHANUMERIC.matcher(instrumentName).replaceAll("_");
        return (multiple ? sanitized + "_" + hubPortCode : sanitized) + extension;
    }
}
