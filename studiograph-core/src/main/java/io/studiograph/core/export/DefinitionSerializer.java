package io.studiograph.core.export;

import io.studiograph.core.config.DefinitionSettings;
import io.studiograph.core.model.AssignSlot;
import io.studiograph.core.model.AutomationLane;
import io.studiograph.core.model.CcMapping;
import io.studiograph.core.model.Connection;
import io.studiograph.core.model.ControllerMaps;
import io.studiograph.core.model.DrumLane;
import io.studiograph.core.model.Instrument;
import io.studiograph.core.model.InstrumentType;
import io.studiograph.core.model.NrpnMapping;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders hub definition files.
 *
 * <p>The output is LF-separated with no trailing newline:
 * <pre>
 * ############# MANUFACTURER NAME #############
 * VERSION 1
 * TRACKNAME MySynth
 * TYPE POLY
 * OUTPORT A
 * OUTCHAN 1
 * INPORT NULL
 * INCHAN NULL
 * MAXRATE NULL
 *
 * [DRUMLANES]    lane:trig:chan:note name, highest lane first, DRUM tracks only
 * [PC]           always empty
 * [CC]           "# section" headers, then "cc name"
 * [NRPN]         "# section" headers, then "msb:lsb:7 name"
 * [ASSIGN]       "cc name default"
 * [AUTOMATION]   CC:n, PB:, AT:, CV:n, NRPN:msb:lsb:depth
 * [COMMENT]      manufacturer name, attribution
 * </pre>
 * Each section is closed by its {@code [/NAME]} marker followed by an empty line,
 * except {@code COMMENT}, which ends the file. Missing values render as {@code NULL}.
 *
 * <p>Rendering is a pure function of its input; it never rejects a slot count, it
 * writes whatever is present.
 */
public class DefinitionSerializer {

    private static final Logger logger = LoggerFactory.getLogger(DefinitionSerializer.class);

    private static final String NULL = "NULL";
    private static final String HEADER_RULE = "#############";

    private final DefinitionSettings settings;

    public DefinitionSerializer(DefinitionSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
    }

    public DefinitionSerializer() {
        this(DefinitionSettings.withDefaults());
    }

    /**
     * Renders a single-route instrument; the track name carries no port suffix.
     */
    public String render(Instrument instrument, String hubPortCode, boolean analog) {
        String trackName = TrackNames.trackName(
            instrument.name(), hubPortCode, false, settings.trackNameMaxLength());
        return render(DeviceDefinition.of(instrument, trackName, hubPortCode, analog));
    }

    public String render(DeviceDefinition definition) {
        List<String> lines = new ArrayList<>();

        lines.add(HEADER_RULE + " "
            + definition.manufacturer().toUpperCase(Locale.ROOT) + " "
            + definition.name().toUpperCase(Locale.ROOT) + " " + HEADER_RULE);
        lines.add("VERSION " + settings.version());
        lines.add("TRACKNAME " + definition.trackName());
        lines.add("TYPE " + definition.type().name());
        lines.add("OUTPORT " + definition.outPort());
        lines.add("OUTCHAN " + orNull(definition.outChannel()));
        lines.add("INPORT " + NULL);
        lines.add("INCHAN " + NULL);
        lines.add("MAXRATE " + NULL);
        lines.add("");

        lines.add("[DRUMLANES]");
        if (definition.type() == InstrumentType.DRUM) {
            definition.drumLanes().stream()
                .sorted(Comparator.comparingInt(DrumLane::lane).reversed())
                .forEach(lane -> lines.add(drumLane(lane)));
        }
        close(lines, "DRUMLANES");

        lines.add("[PC]");
        close(lines, "PC");

        lines.add("[CC]");
        Map<String, List<CcMapping>> ccGroups =
            ControllerMaps.groupCcBySection(definition.ccMappings(), settings.defaultSection());
        ccGroups.forEach((section, mappings) -> {
            lines.add("# " + section);
            mappings.forEach(mapping -> lines.add(mapping.ccNumber() + " " + mapping.paramName()));
            lines.add("");
        });
        close(lines, "CC");

        lines.add("[NRPN]");
        Map<String, List<NrpnMapping>> nrpnGroups =
            ControllerMaps.groupNrpnBySection(definition.nrpnMappings(), settings.defaultSection());
        nrpnGroups.forEach((section, mappings) -> {
            lines.add("# " + section);
            mappings.forEach(mapping ->
                lines.add(mapping.msb() + ":" + mapping.lsb() + ":7 " + mapping.paramName()));
            lines.add("");
        });
        close(lines, "NRPN");

        lines.add("[ASSIGN]");
        for (AssignSlot slot : definition.assignSlots()) {
            lines.add(slot.ccNumber() + " " + slot.paramName() + " " + slot.defaultValue());
        }
        close(lines, "ASSIGN");

        lines.add("[AUTOMATION]");
        definition.automationLanes().forEach(lane -> lines.add(automationLane(lane)));
        close(lines, "AUTOMATION");

        lines.add("[COMMENT]");
        lines.add(definition.manufacturer() + " " + definition.name());
        lines.add(settings.attribution());
        lines.add("[/COMMENT]");

        return String.join("\n", lines);
    }

    /**
     * Resolves the graph and renders one file per (instrument, hub port code).
     * Instruments with more than one route get port-suffixed track and file names.
     * File names are unique across the result: a name already taken by another
     * instrument gets the {@code _{code}} suffix, then a {@code _{n}} counter.
     */
    public List<DefinitionFile> renderAll(List<Instrument> instruments, List<Connection> connections) {
        List<ResolvedRoute> routes = ConnectionResolver.resolve(instruments, connections);

        Map<String, Integer> routesPerInstrument = new HashMap<>();
        routes.forEach(route -> routesPerInstrument.merge(route.instrumentId(), 1, Integer::sum));

        List<DefinitionFile> files = new ArrayList<>(routes.size());
        Set<String> usedFilenames = new HashSet<>();
        for (ResolvedRoute route : routes) {
            Instrument instrument = route.instrument();
            boolean multiple = routesPerInstrument.get(route.instrumentId()) > 1;

            String trackName = TrackNames.trackName(
                instrument.name(), route.hubPortCode(), multiple, settings.trackNameMaxLength());
            String filename = uniqueFilename(
                TrackNames.filename(instrument.name(), route.hubPortCode(), multiple, settings.filenameExtension()),
                route.hubPortCode(),
                usedFilenames);
            String content = render(DeviceDefinition.of(instrument, trackName, route.hubPortCode(), route.analog()));

            files.add(new DefinitionFile(instrument.id(), filename, content));
        }

        logger.debug("Rendered {} definition file(s)", files.size());
        return List.copyOf(files);
    }

    private String uniqueFilename(String filename, String hubPortCode, Set<String> used) {
        if (used.add(filename)) {
            return filename;
        }
        String extension = settings.filenameExtension();
        String stem = filename.substring(0, filename.length() - extension.length());
        String candidate = stem + "_" + hubPortCode + extension;
        for (int n = 2; !used.add(candidate); n++) {
            candidate = stem + "_" + n + extension;
        }
        logger.warn("Definition file name {} is already taken, writing {} instead", filename, candidate);
        return candidate;
    }

    private static void close(List<String> lines, String section) {
        lines.add("[/" + section + "]");
        lines.add("");
    }

    private static String drumLane(DrumLane lane) {
        return lane.lane() + ":" + orNull(lane.trig()) + ":" + orNull(lane.chan()) + ":"
            + orNull(lane.note()) + " " + lane.name();
    }

    private static String automationLane(AutomationLane lane) {
        return switch (lane.type()) {
            case CC -> "CC:" + orDefault(lane.ccNumber(), 0);
            case PB -> "PB:";
            case AT -> "AT:";
            case CV -> "CV:" + orDefault(lane.cvNumber(), 1);
            case NRPN -> "NRPN:" + orDefault(lane.nrpnMsb(), 0) + ":" + orDefault(lane.nrpnLsb(), 0)
                + ":" + orDefault(lane.nrpnDepth(), 7);
        };
    }

    private static String orNull(Object value) {
        return value == null ? NULL : value.toString();
    }

    private static int orDefault(Integer value, int fallback) {
        return value == null ? fallback : value;
    }
}
