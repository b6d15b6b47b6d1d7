package io.studiograph.cli;

import io.studiograph.core.export.DefinitionFile;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes rendered definitions into a directory, one file each, replacing existing files.
 */
public class DefinitionWriter {
    private static final Logger logger = LoggerFactory.getLogger(DefinitionWriter.class);

    private final Path directory;

    public DefinitionWriter(Path directory) {
        this.directory = directory;
    }

    public List<Path> writeAll(List<DefinitionFile> definitions) throws IOException {
        Files.createDirectories(directory);

        List<Path> written = new ArrayList<>(definitions.size());
        for (DefinitionFile definition : definitions) {
            Path target = directory.resolve(definition.filename());
            Files.writeString(target, definition.content(), StandardCharsets.UTF_8);
            logger.info("Wrote {} for {}", target.getFileName(), definition.instrumentId());
            written.add(target);
        }
        return written;
    }
}
