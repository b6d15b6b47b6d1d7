package io.studiograph.cli;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Sub-commands of the command-line tool.
 */
public enum Command {
    /**
     * Report whether the studio has a feedback loop.
     */
    CHECK(1),

    /**
     * Write one hub definition file per exported track.
     */
    EXPORT(2);

    private final int operandCount;

    Command(int operandCount) {
        this.operandCount = operandCount;
    }

    int operandCount() {
        return operandCount;
    }

    static Optional<Command> fromName(String name) {
        return Arrays.stream(values())
            .filter(command -> command.name().equals(name.toUpperCase(Locale.ROOT)))
            .findFirst();
    }
}
