package com.agentlog.ontology.serial;

import com.agentlog.ontology.schema.OntologyEnum;
import com.agentlog.ontology.schema.ValidationException;
import com.google.gson.Gson;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

/**
 * Reads and writes {@link OntologyEnum} constants by their string tag.
 * A tag outside the closed set is a {@link ValidationException}, never a silent null.
 */
final class OntologyEnumTypeAdapterFactory implements TypeAdapterFactory {

    @Override
    @SuppressWarnings("unchecked")
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        Class<? super T> raw = type.getRawType();
        if (!raw.isEnum() || !OntologyEnum.class.isAssignableFrom(raw)) {
            return null;
        }
        return (TypeAdapter<T>) new TagAdapter(raw);
    }

    private static final class TagAdapter extends TypeAdapter<OntologyEnum> {
        private final Class<?> enumType;

        TagAdapter(Class<?> enumType) {
            this.enumType = enumType;
        }

        @Override
        public void write(JsonWriter out, OntologyEnum value) throws IOException {
            if (value == null) {
                out.nullValue();
            } else {
                out.value(value.tag());
            }
        }

        @Override
        public OntologyEnum read(JsonReader in) throws IOException {
            String path = in.getPath();
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            String tag = in.nextString();
            for (Object constant : enumType.getEnumConstants()) {
                OntologyEnum candidate = (OntologyEnum) constant;
                if (candidate.tag().equals(tag)) return candidate;
            }
            throw ValidationException.unknownTag(enumType.getSimpleName(), tag, path);
        }
    }
}
