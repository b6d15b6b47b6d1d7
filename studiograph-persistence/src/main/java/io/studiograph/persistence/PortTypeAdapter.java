package io.studiograph.persistence;

import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.studiograph.core.model.PortType;
import java.io.IOException;

/**
 * Writes {@link PortType} as its lower-case save-file name ({@code "midi"}, {@code "usb"}, ...).
 */
final class PortTypeAdapter extends TypeAdapter<PortType> {

    @Override
    public void write(JsonWriter out, PortType value) throws IOException {
        if (value == null) {
            out.nullValue();
            return;
        }
        out.value(value.wireName());
    }

    @Override
    public PortType read(JsonReader in) throws IOException {
        if (in.peek() == JsonToken.NULL) {
            in.nextNull();
            return null;
        }
        String wireName = in.nextString();
        return PortType.fromWireName(wireName)
            .orElseThrow(() -> new JsonParseException("Unknown port type: " + wireName));
    }
}
