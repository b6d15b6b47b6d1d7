package io.studiograph.persistence;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.reflect.TypeToken;
import io.studiograph.core.model.Connection;
import io.studiograph.core.model.Instrument;
import io.studiograph.core.model.InstrumentPreset;
import io.studiograph.core.model.PortType;
import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes studio save files.
 *
 * <p>Reading validates the envelope, runs {@link StudioFileMigration} on the JSON tree
 * and only then converts to typed records, so a file is either loaded completely or
 * rejected with a {@link StudioFileException}:
 * <ul>
 *   <li>{@code "Invalid file format: missing required fields"} - no version, instruments or connections</li>
 *   <li>{@code "Unsupported file version: N"} - any version other than 1</li>
 *   <li>{@code "Invalid file format: instruments and connections must be arrays"}</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 * StudioFileCodec codec = new StudioFileCodec();
 * StudioFile file = codec.read(Path.of("studio.json"));
 * file.applyTo(graph);
 *
 * codec.write(Path.of("studio.json"), StudioFile.snapshot(graph));
 * </pre>
 */
public class StudioFileCodec {
    private static final Logger logger = LoggerFactory.getLogger(StudioFileCodec.class);

    private static final Type INSTRUMENTS = new TypeToken<List<Instrument>>() { }.getType();
    private static final Type CONNECTIONS = new TypeToken<List<Connection>>() { }.getType();
    private static final Type PRESETS = new TypeToken<List<InstrumentPreset>>() { }.getType();

    private final Gson gson;

    public StudioFileCodec() {
        this.gson = new GsonBuilder()
            .setPrettyPrinting()
            .registerTypeAdapter(PortType.class, new PortTypeAdapter().nullSafe())
            .create();
    }

    /**
     * Parses and migrates save-file JSON.
     *
     * @throws StudioFileException if the JSON is malformed or not a valid version-1 studio
     */
    public StudioFile parse(String json) throws StudioFileException {
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new StudioFileException("Invalid JSON: " + rootMessage(e), e);
        }

        if (!root.isJsonObject()) {
            throw new StudioFileException("Invalid file format: missing required fields");
        }
        JsonObject data = root.getAsJsonObject();
        if (!hasVersion(data) || isMissing(data, "instruments") || isMissing(data, "connections")) {
            throw new StudioFileException("Invalid file format: missing required fields");
        }

        JsonPrimitive version = data.get("version").getAsJsonPrimitive();
        if (!version.isNumber() || version.getAsDouble() != StudioFile.CURRENT_VERSION) {
            throw new StudioFileException("Unsupported file version: " + version.getAsString());
        }

        if (!data.get("instruments").isJsonArray() || !data.get("connections").isJsonArray()) {
            throw new StudioFileException("Invalid file format: instruments and connections must be arrays");
        }

        JsonArray instruments = data.getAsJsonArray("instruments");
        JsonArray connections = data.getAsJsonArray("connections");
        JsonArray presets = data.has("presets") && data.get("presets").isJsonArray()
            ? data.getAsJsonArray("presets")
            : new JsonArray();
        String exportedAt = data.has("exportedAt") && data.get("exportedAt").isJsonPrimitive()
            ? data.get("exportedAt").getAsString()
            : "";

        StudioFileMigration.migrate(instruments, connections, presets);

        try {
            StudioFile file = new StudioFile(
                StudioFile.CURRENT_VERSION,
                exportedAt,
                gson.fromJson(instruments, INSTRUMENTS),
                gson.fromJson(connections, CONNECTIONS),
                gson.fromJson(presets, PRESETS)
            );
            logger.debug("Parsed studio file: {} instrument(s), {} connection(s), {} preset(s)",
                file.instruments().size(), file.connections().size(), file.presets().size());
            return file;
        } catch (RuntimeException e) {
            throw new StudioFileException("Invalid file format: " + rootMessage(e), e);
        }
    }

    /**
     * Serializes a studio as pretty-printed version-1 JSON.
     */
    public String write(StudioFile file) {
        JsonObject root = new JsonObject();
        root.addProperty("version", StudioFile.CURRENT_VERSION);
        root.addProperty("exportedAt", file.exportedAt());
        root.add("instruments", gson.toJsonTree(file.instruments(), INSTRUMENTS));
        root.add("connections", gson.toJsonTree(file.connections(), CONNECTIONS));
        root.add("presets", gson.toJsonTree(file.presets(), PRESETS));
        return gson.toJson(root);
    }

    public StudioFile read(Path path) throws StudioFileException {
        String json;
        try {
            json = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StudioFileException("Failed to read " + path + ": " + e.getMessage(), e);
        }
        StudioFile file = parse(json);
        logger.info("Loaded studio from {}", path);
        return file;
    }

    public void write(Path path, StudioFile file) throws StudioFileException {
        try {
            Files.writeString(path, write(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StudioFileException("Failed to write " + path + ": " + e.getMessage(), e);
        }
        logger.info("Saved studio to {}", path);
    }

    private static boolean hasVersion(JsonObject data) {
        JsonElement version = data.get("version");
        if (version == null || !version.isJsonPrimitive()) {
            return false;
        }
        JsonPrimitive primitive = version.getAsJsonPrimitive();
        return !(primitive.isNumber() && primitive.getAsDouble() == 0)
            && !(primitive.isString() && primitive.getAsString().isEmpty())
            && !(primitive.isBoolean() && !primitive.getAsBoolean());
    }

    private static boolean isMissing(JsonObject data, String key) {
        return !data.has(key) || data.get(key).isJsonNull();
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}
