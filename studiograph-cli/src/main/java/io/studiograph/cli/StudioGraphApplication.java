package io.studiograph.cli;

import io.studiograph.core.config.ConfigurationException;
import io.studiograph.core.config.DefinitionSettings;
import io.studiograph.core.export.DefinitionFile;
import io.studiograph.core.export.DefinitionSerializer;
import io.studiograph.core.graph.CycleReport;
import io.studiograph.core.graph.StudioGraph;
import io.studiograph.persistence.StudioFile;
import io.studiograph.persistence.StudioFileCodec;
import io.studiograph.persistence.StudioFileException;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * StudioGraph command-line tool.
 *
 * <p>Commands:
 * <ul>
 *   <li>{@code check <studio.json>} - report a feedback loop. Exit code 0 when there is
 *       none, 2 when there is one.</li>
 *   <li>{@code export <studio.json> <output-dir>} - write one hub definition file per
 *       exported track. Exit code 0.</li>
 * </ul>
 * Exit code 1 means the arguments or the studio file were invalid, or a file could not
 * be written.
 */
public class StudioGraphApplication {

    private static final Logger logger = LoggerFactory.getLogger(StudioGraphApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_LOOP = 2;

    private final StudioFileCodec codec;
    private final PrintStream out;

    public StudioGraphApplication(StudioFileCodec codec, PrintStream out) {
        this.codec = codec;
        this.out = out;
    }

    public static void main(String[] args) {
        CliConfig config;
        try {
            config = CliConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(CliConfig.USAGE);
            System.exit(EXIT_FAILURE);
            return;
        }
        System.exit(new StudioGraphApplication(new StudioFileCodec(), System.out).run(config));
    }

    /**
     * Runs one command and returns the process exit code.
     */
    public int run(CliConfig config) {
        try {
            StudioGraph graph = load(config.studioFile());
            return switch (config.command()) {
                case CHECK -> check(graph);
                case EXPORT -> export(graph, config.outputDirectory(), config.device());
            };
        } catch (StudioFileException e) {
            logger.error("Cannot load {}: {}", config.studioFile(), e.getMessage());
            return EXIT_FAILURE;
        } catch (ConfigurationException e) {
            logger.error("Invalid settings for device '{}': {}", config.device(), e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            logger.error("Failed to write definitions to {}", config.outputDirectory(), e);
            return EXIT_FAILURE;
        }
    }

    private StudioGraph load(Path studioFile) throws StudioFileException {
        StudioFile file = codec.read(studioFile);
        StudioGraph graph = new StudioGraph();
        file.applyTo(graph);
        return graph;
    }

    private int check(StudioGraph graph) {
        CycleReport report = graph.loopStatus();
        if (!report.hasCycle()) {
            out.println("No feedback loop");
            return EXIT_OK;
        }
        out.println("Feedback loop through " + String.join(" -> ", report.instrumentIds()));
        report.connectionIds().forEach(id -> out.println("  " + id));
        return EXIT_LOOP;
    }

    private int export(StudioGraph graph, Path outputDirectory, String device) throws IOException {
        DefinitionSerializer serializer = new DefinitionSerializer(DefinitionSettings.forDevice(device));
        List<DefinitionFile> definitions = serializer.renderAll(graph.instruments(), graph.connections());
        if (definitions.isEmpty()) {
            logger.warn("No instruments are connected to the hub, nothing to export");
        }

        List<Path> written = new DefinitionWriter(outputDirectory).writeAll(definitions);
        logger.info("Exported {} definition file(s) to {}", written.size(), outputDirectory);
        written.forEach(path -> out.println(path));
        return EXIT_OK;
    }
}
