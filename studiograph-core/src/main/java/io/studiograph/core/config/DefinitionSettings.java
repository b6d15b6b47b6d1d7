package io.studiograph.core.config;

import java.util.Objects;

/**
 * Settings for rendering hub definition files.
 * <p>
 * <strong>Usage:</strong>
 * <pre>
 * // Recommended: device configuration (device file, then global defaults)
 * DefinitionSettings settings = DefinitionSettings.forDevice("hapax");
 *
 * // Alternative: built-in defaults
 * DefinitionSettings defaults = DefinitionSettings.withDefaults();
 * </pre>
 *
 * @param version format version written on the {@code VERSION} line
 * @param trackNameMaxLength hub display limit for {@code TRACKNAME}
 * @param defaultSection section name for CC and NRPN entries without one
 * @param attribution fixed line written in the {@code COMMENT} section
 * @param filenameExtension extension appended to generated file names
 */
public record DefinitionSettings(
    int version,
    int trackNameMaxLength,
    String defaultSection,
    String attribution,
    String filenameExtension
) {
    public DefinitionSettings {
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1, got: " + version);
        }
        if (trackNameMaxLength < 1) {
            throw new IllegalArgumentException(
                "trackNameMaxLength must be >= 1, got: " + trackNameMaxLength
            );
        }
        Objects.requireNonNull(defaultSection, "defaultSection cannot be null");
        if (defaultSection.isBlank()) {
            throw new IllegalArgumentException("defaultSection cannot be blank");
        }
        Objects.requireNonNull(attribution, "attribution cannot be null");
        Objects.requireNonNull(filenameExtension, "filenameExtension cannot be null");
    }

    /**
     * Create DefinitionSettings from configuration.
     *
     * @param config Hierarchical configuration
     * @return DefinitionSettings with values from config
     * @throws ConfigurationException if a key is missing or malformed
     */
    public static DefinitionSettings fromConfig(HierarchicalConfig config) {
        return new DefinitionSettings(
            config.getInt("definition.version"),
            config.getInt("definition.track-name.max-length"),
            config.getString("definition.section.default"),
            config.getString("definition.comment.attribution"),
            config.getString("definition.filename.extension")
        );
    }

    /**
     * Create DefinitionSettings for a specific hub device.
     *
     * @param deviceName Device key (e.g., "hapax")
     * @return settings from {@code studiograph_{deviceName}.properties}, falling back to global
     */
    public static DefinitionSettings forDevice(String deviceName) {
        return fromConfig(HierarchicalConfig.forDevice(deviceName));
    }

    /**
     * Settings matching the Hapax definition format.
     */
    public static DefinitionSettings withDefaults() {
        return new DefinitionSettings(1, 12, "General", "Generated by StudioGraph", ".txt");
    }
}
