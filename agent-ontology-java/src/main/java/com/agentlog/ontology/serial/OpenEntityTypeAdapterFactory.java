package com.agentlog.ontology.serial;

import com.agentlog.ontology.schema.OntologyException;
import com.agentlog.ontology.schema.OpenEntity;
import com.agentlog.ontology.schema.SchemaFields;
import com.agentlog.ontology.schema.ValidationException;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wraps Gson's reflective adapter for every {@link OpenEntity} subtype.
 *
 * On read: keys with no declared field go to {@code extraFields}, the rest are
 * bound reflectively, then {@link OpenEntity#validate()} runs. Any schema error
 * raised at or below this entity is re-rooted at the entity's JSON path.
 * On write: extra fields follow the declared ones.
 */
final class OpenEntityTypeAdapterFactory implements TypeAdapterFactory {

    @Override
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        if (!OpenEntity.class.isAssignableFrom(type.getRawType())) {
            return null;
        }
        TypeAdapter<T> delegate = gson.getDelegateAdapter(this, type);
        TypeAdapter<JsonElement> elements = gson.getAdapter(JsonElement.class);
        return new EntityAdapter<>(delegate, elements, type.getRawType());
    }

    private static final class EntityAdapter<T> extends TypeAdapter<T> {
        private final TypeAdapter<T> delegate;
        private final TypeAdapter<JsonElement> elements;
        private final Class<?> rawType;
        private final SchemaFields fields;

        EntityAdapter(TypeAdapter<T> delegate, TypeAdapter<JsonElement> elements, Class<?> rawType) {
            this.delegate = delegate;
            this.elements = elements;
            this.rawType = rawType;
            this.fields = SchemaFields.of(rawType);
        }

        @Override
        public void write(JsonWriter out, T value) throws IOException {
            if (value == null) {
                out.nullValue();
                return;
            }
            JsonObject tree = delegate.toJsonTree(value).getAsJsonObject();
            Map<String, JsonElement> extras = ((OpenEntity) value).extraFields;
            if (extras != null) {
                for (Map.Entry<String, JsonElement> e : extras.entrySet()) {
                    // a declared field always wins over an extra of the same name
                    if (!tree.has(e.getKey())) {
                        tree.add(e.getKey(), e.getValue());
                    }
                }
            }
            elements.write(out, tree);
        }

        @Override
        public T read(JsonReader in) throws IOException {
            String path = in.getPath();
            JsonElement tree = elements.read(in);
            if (tree == null || tree.isJsonNull()) {
                return null;
            }
            String entity = rawType.getSimpleName();
            if (!tree.isJsonObject()) {
                throw ValidationException.typeMismatch(entity, path, "expected a JSON object", null);
            }

            JsonObject known = new JsonObject();
            Map<String, JsonElement> extras = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> e : tree.getAsJsonObject().entrySet()) {
                String key = e.getKey();
                JsonElement v = e.getValue();
                if (!fields.isDeclared(key)) {
                    extras.put(key, v);
                } else if (!(v.isJsonNull() && fields.defaultsOnNull(key))) {
                    known.add(key, v);
                }
            }

            try {
                T result = delegate.fromJsonTree(known);
                OpenEntity openEntity = (OpenEntity) result;
                openEntity.extraFields = extras;
                fields.clearJsonNulls(openEntity);
                openEntity.validate();
                return result;
            } catch (OntologyException e) {
                throw e.under(path);
            } catch (JsonParseException | IllegalArgumentException e) {
                throw ValidationException.typeMismatch(entity, path, e.getMessage(), e);
            }
        }
    }
}
