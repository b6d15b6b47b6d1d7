package io.studiograph.cli;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Command-line configuration.
 *
 * @param command sub-command to run
 * @param studioFile studio save file to load
 * @param outputDirectory target directory for {@link Command#EXPORT}, null for {@link Command#CHECK}
 * @param device hub device key used to look up definition settings (e.g., "hapax")
 */
public record CliConfig(
    Command command,
    Path studioFile,
    Path outputDirectory,
    String device
) {
    static final String DEVICE_ENV = "STUDIOGRAPH_DEVICE";
    static final String DEFAULT_DEVICE = "hapax";

    static final String USAGE = String.join("\n",
        "Usage:",
        "  studiograph check <studio.json>",
        "  studiograph export <studio.json> <output-dir>",
        "",
        "Environment:",
        "  " + DEVICE_ENV + "  hub device settings to use (default: " + DEFAULT_DEVICE + ")");

    public CliConfig {
        Objects.requireNonNull(command, "command cannot be null");
        Objects.requireNonNull(studioFile, "studioFile cannot be null");
        Objects.requireNonNull(device, "device cannot be null");
        if (command == Command.EXPORT && outputDirectory == null) {
            throw new IllegalArgumentException("export requires an output directory");
        }
    }

    public static CliConfig fromArgs(String... args) {
        return fromArgs(System.getenv(), args);
    }

    /**
     * Parses arguments against the given environment.
     *
     * @throws IllegalArgumentException if the command is unknown or operands are missing
     */
    static CliConfig fromArgs(Map<String, String> env, String... args) {
        if (args == null || args.length == 0) {
            throw new IllegalArgumentException("Missing command");
        }
        Command command = Command.fromName(args[0])
            .orElseThrow(() -> new IllegalArgumentException("Unknown command: " + args[0]));
        if (args.length != command.operandCount() + 1) {
            throw new IllegalArgumentException(
                "'" + args[0] + "' expects " + command.operandCount() + " argument(s), got " + (args.length - 1)
            );
        }

        String device = env.getOrDefault(DEVICE_ENV, DEFAULT_DEVICE);
        if (device.isBlank()) {
            device = DEFAULT_DEVICE;
        }

        return new CliConfig(
            command,
            Path.of(args[1]),
            command == Command.EXPORT ? Path.of(args[2]) : null,
            device.trim()
        );
    }
}
