package io.studiograph.core.export;

/**
 * A rendered definition ready to be written.
 */
public record DefinitionFile(
    String instrumentId,
    String filename,
    String content
) {
}
