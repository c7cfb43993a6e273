package com.agentlog.ontology.serial;

import com.agentlog.ontology.schema.Timestamps;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.time.OffsetDateTime;

final class OffsetDateTimeAdapter extends TypeAdapter<OffsetDateTime> {

    @Override
    public void write(JsonWriter out, OffsetDateTime value) throws IOException {
        if (value == null) {
            out.nullValue();
        } else {
            out.value(Timestamps.format(value));
        }
    }

    @Override
    public OffsetDateTime read(JsonReader in) throws IOException {
        String path = in.getPath();
        if (in.peek() == JsonToken.NULL) {
            in.nextNull();
            return null;
        }
        return Timestamps.parse(in.nextString(), path);
    }
}
