package io.studiograph.persistence;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import io.studiograph.core.model.Connection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Upgrades older version-1 save files in place, on the JSON tree, before typed conversion.
 *
 * <p>Applied steps:
 * <ul>
 *   <li>backfill {@code automationLanes} (empty), {@code showCvPorts} (false) and {@code channel} (1)</li>
 *   <li>legacy drum lanes {@code {channel, note, name}} become {@code {lane, trig, chan, note, name}}</li>
 *   <li>hub outputs: {@code usb-device-out} becomes {@code usb-device}; a missing {@code midi-d} is
 *       inserted after {@code midi-c}; the old hub {@code usb-device} input is dropped</li>
 *   <li>instrument and preset ports: {@code usb-in-N} becomes {@code usb-device-N},
 *       {@code usb-out-N} becomes {@code usb-host-N}</li>
 *   <li>connections follow port renames and get re-derived ids; connections into the dropped
 *       hub input are removed; a missing medium is taken from the source output port,
 *       or {@code midi} when that port is unknown</li>
 * </ul>
 */
final class StudioFileMigration {
    private static final Logger logger = LoggerFactory.getLogger(StudioFileMigration.class);

    private static final String LEGACY_HUB_USB_OUT = "usb-device-out";
    private static final String HUB_USB_DEVICE = "usb-device";
    private static final Pattern LEGACY_USB_IN = Pattern.compile("usb-in-(\\d+)");
    private static final Pattern LEGACY_USB_OUT = Pattern.compile("usb-out-(\\d+)");

    private StudioFileMigration() {
    }

    /**
     * Migrates the instruments, connections and presets arrays in place.
     *
     * @throws StudioFileException if an entry is not a JSON object
     */
    static void migrate(JsonArray instruments, JsonArray connections, JsonArray presets) throws StudioFileException {
        String hubId = null;
        Map<String, Map<String, String>> outputTypes = new HashMap<>();
        for (JsonElement element : instruments) {
            JsonObject instrument = requireObject(element, "instrument");
            migrateInstrument(instrument);
            if (hubId == null && isTrue(instrument, "hub")) {
                hubId = string(instrument, "id");
                migrateHubPorts(instrument);
            } else {
                renamePorts(instrument);
            }
            String id = string(instrument, "id");
            if (id != null) {
                outputTypes.putIfAbsent(id, outputTypesOf(instrument));
            }
        }

        for (JsonElement element : presets) {
            renamePorts(requireObject(element, "preset"));
        }

        Iterator<JsonElement> iterator = connections.iterator();
        while (iterator.hasNext()) {
            JsonObject connection = requireObject(iterator.next(), "connection");
            if (hubId != null
                && hubId.equals(string(connection, "target"))
                && HUB_USB_DEVICE.equals(string(connection, "targetHandle"))) {
                logger.warn("Dropping connection {} into removed hub input {}", string(connection, "id"), HUB_USB_DEVICE);
                iterator.remove();
                continue;
            }
            migrateConnection(connection, outputTypes);
        }
    }

    private static void migrateInstrument(JsonObject instrument) {
        if (!isArray(instrument, "automationLanes")) {
            instrument.add("automationLanes", new JsonArray());
        }
        if (!instrument.has("showCvPorts") || instrument.get("showCvPorts").isJsonNull()) {
            instrument.addProperty("showCvPorts", false);
        }
        if (!instrument.has("channel") || instrument.get("channel").isJsonNull()) {
            instrument.addProperty("channel", 1);
        }
        if (isArray(instrument, "drumLanes")) {
            JsonArray migrated = new JsonArray();
            for (JsonElement lane : instrument.getAsJsonArray("drumLanes")) {
                if (lane.isJsonObject()) {
                    migrated.add(migrateDrumLane(lane.getAsJsonObject()));
                }
            }
            instrument.add("drumLanes", migrated);
        }
    }

    private static JsonObject migrateDrumLane(JsonObject legacy) {
        JsonObject lane = new JsonObject();
        lane.add("lane", firstPresent(legacy, "lane", "channel"));
        if (lane.get("lane").isJsonNull()) {
            lane.addProperty("lane", 1);
        }
        lane.add("trig", firstPresent(legacy, "trig"));
        lane.add("chan", firstPresent(legacy, "chan"));
        lane.add("note", firstPresent(legacy, "note"));
        String name = string(legacy, "name");
        lane.addProperty("name", name == null ? "" : name);
        return lane;
    }

    private static void migrateHubPorts(JsonObject hub) {
        if (isArray(hub, "outputs")) {
            JsonArray outputs = hub.getAsJsonArray("outputs");
            int midiC = -1;
            boolean hasMidiD = false;
            for (int i = 0; i < outputs.size(); i++) {
                if (!outputs.get(i).isJsonObject()) {
                    continue;
                }
                JsonObject port = outputs.get(i).getAsJsonObject();
                String id = string(port, "id");
                if (LEGACY_HUB_USB_OUT.equals(id)) {
                    port.addProperty("id", HUB_USB_DEVICE);
                } else if ("midi-c".equals(id)) {
                    midiC = i;
                } else if ("midi-d".equals(id)) {
                    hasMidiD = true;
                }
            }
            if (midiC >= 0 && !hasMidiD) {
                JsonObject midiD = new JsonObject();
                midiD.addProperty("id", "midi-d");
                midiD.addProperty("label", "MIDI D");
                midiD.addProperty("type", "midi");
                insert(outputs, midiC + 1, midiD);
            }
        }

        if (isArray(hub, "inputs")) {
            Iterator<JsonElement> inputs = hub.getAsJsonArray("inputs").iterator();
            while (inputs.hasNext()) {
                JsonElement port = inputs.next();
                if (port.isJsonObject() && HUB_USB_DEVICE.equals(string(port.getAsJsonObject(), "id"))) {
                    inputs.remove();
                }
            }
        }
    }

    private static void renamePorts(JsonObject owner) {
        for (String direction : new String[] {"inputs", "outputs"}) {
            if (!isArray(owner, direction)) {
                continue;
            }
            for (JsonElement element : owner.getAsJsonArray(direction)) {
                if (element.isJsonObject()) {
                    JsonObject port = element.getAsJsonObject();
                    String id = string(port, "id");
                    if (id != null) {
                        port.addProperty("id", renameHandle(id));
                    }
                }
            }
        }
    }

    private static Map<String, String> outputTypesOf(JsonObject instrument) {
        Map<String, String> types = new HashMap<>();
        if (isArray(instrument, "outputs")) {
            for (JsonElement element : instrument.getAsJsonArray("outputs")) {
                if (element.isJsonObject()) {
                    JsonObject port = element.getAsJsonObject();
                    String id = string(port, "id");
                    String type = string(port, "type");
                    if (id != null && type != null) {
                        types.putIfAbsent(id, type);
                    }
                }
            }
        }
        return types;
    }

    private static void migrateConnection(JsonObject connection, Map<String, Map<String, String>> outputTypes) {
        String source = string(connection, "source");
        String target = string(connection, "target");
        String sourceHandle = string(connection, "sourceHandle");
        String targetHandle = string(connection, "targetHandle");

        if (!connection.has("medium") || connection.get("medium").isJsonNull()) {
            String medium = source == null || sourceHandle == null
                ? null
                : outputTypes.getOrDefault(source, Map.of()).get(renameHandle(sourceHandle));
            connection.addProperty("medium", medium == null ? "midi" : medium);
        }

        if (source == null || target == null || sourceHandle == null || targetHandle == null) {
            return;
        }

        String newSourceHandle = renameHandle(sourceHandle);
        String newTargetHandle = renameHandle(targetHandle);
        if (!newSourceHandle.equals(sourceHandle) || !newTargetHandle.equals(targetHandle)) {
            connection.addProperty("sourceHandle", newSourceHandle);
            connection.addProperty("targetHandle", newTargetHandle);
            connection.addProperty("id", Connection.idFor(source, newSourceHandle, target, newTargetHandle));
        }
    }

    static String renameHandle(String handle) {
        if (LEGACY_HUB_USB_OUT.equals(handle)) {
            return HUB_USB_DEVICE;
        }
        Matcher usbIn = LEGACY_USB_IN.matcher(handle);
        if (usbIn.matches()) {
            return "usb-device-" + usbIn.group(1);
        }
        Matcher usbOut = LEGACY_USB_OUT.matcher(handle);
        if (usbOut.matches()) {
            return "usb-host-" + usbOut.group(1);
        }
        return handle;
    }

    // =========================================================================
    // JSON helpers
    // =========================================================================

    private static JsonObject requireObject(JsonElement element, String kind) throws StudioFileException {
        if (element == null || !element.isJsonObject()) {
            throw new StudioFileException("Invalid file format: " + kind + " entries must be objects");
        }
        return element.getAsJsonObject();
    }

    private static JsonElement firstPresent(JsonObject object, String... keys) {
        for (String key : keys) {
            if (object.has(key) && !object.get(key).isJsonNull()) {
                return object.get(key);
            }
        }
        return JsonNull.INSTANCE;
    }

    private static boolean isArray(JsonObject object, String key) {
        return object.has(key) && object.get(key).isJsonArray();
    }

    private static boolean isTrue(JsonObject object, String key) {
        JsonElement value = object.get(key);
        return value != null && value.isJsonPrimitive()
            && value.getAsJsonPrimitive().isBoolean() && value.getAsBoolean();
    }

    private static String string(JsonObject object, String key) {
        JsonElement value = object.get(key);
        return value != null && value.isJsonPrimitive() ? value.getAsString() : null;
    }

    private static void insert(JsonArray array, int index, JsonElement element) {
        array.add(element);
        for (int i = array.size() - 1; i > index; i--) {
            array.set(i, array.get(i - 1));
        }
        array.set(index, element);
    }
}
