package io.studiograph.core.config;

import java.util.Locale;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.ResourceBundle;

/**
 * Hierarchical configuration using ResourceBundle (zero dependencies).
 *
 * <p>Supports fallback chain:
 * <ol>
 *   <li>studiograph_{device}.properties (hub-device specific)</li>
 *   <li>studiograph.properties (global defaults)</li>
 * </ol>
 *
 * <p>The device key is carried as a {@link Locale} language tag, so
 * ResourceBundle resolves the device file first and falls back to the
 * global file for every key the device file does not define.
 *
 * <p><strong>Example Property Files:</strong>
 * <pre>
 * # studiograph.properties (global defaults)
 * definition.track-name.max-length=12
 *
 * # studiograph_hapax.properties (device override)
 * definition.comment.attribution=Exported for Hapax
 * </pre>
 *
 * <p><strong>Usage:</strong>
 * <pre>
 * HierarchicalConfig global = HierarchicalConfig.global();
 * int limit = global.getInt("definition.track-name.max-length");
 *
 * HierarchicalConfig hapax = HierarchicalConfig.forDevice("hapax");
 * String attribution = hapax.getString("definition.comment.attribution");
 * </pre>
 *
 * <p><strong>System Property Overrides:</strong>
 * <p>System properties take precedence over all property files:
 * <pre>
 * java -Ddefinition.comment.attribution="My Studio" -jar studiograph-cli.jar ...
 * </pre>
 */
public class HierarchicalConfig {

    static final String BUNDLE_NAME = "studiograph";

    private final ResourceBundle bundle;
    private final String context;  // For debugging/logging

    private HierarchicalConfig(ResourceBundle bundle, String context) {
        this.bundle = bundle;
        this.context = context;
    }

    /**
     * Get global configuration (studiograph.properties).
     *
     * @return Global configuration
     */
    public static HierarchicalConfig global() {
        ResourceBundle bundle = ResourceBundle.getBundle(BUNDLE_NAME, Locale.ROOT);
        return new HierarchicalConfig(bundle, "global");
    }

    /**
     * Get hub-device specific configuration.
     *
     * <p>Fallback chain:
     * <ol>
     *   <li>studiograph_{deviceName}.properties</li>
     *   <li>studiograph.properties (global)</li>
     * </ol>
     *
     * @param deviceName Device key (e.g., "hapax")
     * @return Device-specific configuration
     */
    public static HierarchicalConfig forDevice(String deviceName) {
        Objects.requireNonNull(deviceName, "deviceName cannot be null");
        if (deviceName.isBlank()) {
            throw new IllegalArgumentException("deviceName cannot be blank");
        }

        Locale deviceLocale = Locale.forLanguageTag(deviceName);
        ResourceBundle bundle = ResourceBundle.getBundle(
            BUNDLE_NAME, deviceLocale, ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES)
        );
        return new HierarchicalConfig(bundle, "device:" + deviceName);
    }

    // =========================================================================
    // Type-safe getters with system property override support
    // =========================================================================

    /**
     * Get string value.
     *
     * <p>Checks system properties first, then ResourceBundle.
     *
     * @param key Property key
     * @return Property value
     * @throws ConfigurationException if key not found
     */
    public String getString(String key) {
        String sysProp = System.getProperty(key);
        if (sysProp != null) {
            return sysProp;
        }

        try {
            return bundle.getString(key);
        } catch (MissingResourceException e) {
            throw new ConfigurationException(
                "Missing config key '" + key + "' in context: " + context, e
            );
        }
    }

    /**
     * Get int value.
     *
     * @param key Property key
     * @return Property value as int
     * @throws ConfigurationException if key not found or invalid format
     */
    public int getInt(String key) {
        String value = getString(key);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                "Invalid int value for key '" + key + "': " + value, e
            );
        }
    }

    @Override
    public String toString() {
        return "HierarchicalConfig[context=" + context + "]";
    }
}
