package io.studiograph.persistence;

/**
 * A studio save file could not be read or written.
 * <p>
 * The message is meant for the user, e.g. {@code "Unsupported file version: 2"}.
 * </p>
 */
public class StudioFileException extends Exception {

    public StudioFileException(String message) {
        super(message);
    }

    public StudioFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
