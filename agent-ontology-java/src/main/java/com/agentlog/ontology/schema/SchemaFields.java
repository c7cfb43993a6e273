package com.agentlog.ontology.schema;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.annotations.SerializedName;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reflective view of the JSON-mapped fields of an entity class.
 *
 * Walks the class hierarchy (superclass fields first) and skips static and
 * transient fields, matching what Gson serializes.
 */
public final class SchemaFields {

    private static final Map<Class<?>, SchemaFields> CACHE = new ConcurrentHashMap<>();

    private final List<Field> fields;
    private final Map<String, Field> byJsonName;

    private SchemaFields(Class<?> type) {
        List<Class<?>> chain = new ArrayList<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            chain.add(0, c);
        }
        List<Field> collected = new ArrayList<>();
        Map<String, Field> names = new LinkedHashMap<>();
        for (Class<?> c : chain) {
            for (Field f : c.getDeclaredFields()) {
                int mods = f.getModifiers();
                if (f.isSynthetic() || Modifier.isStatic(mods) || Modifier.isTransient(mods)) continue;
                collected.add(f);
                SerializedName ann = f.getAnnotation(SerializedName.class);
                names.put(ann != null ? ann.value() : f.getName(), f);
            }
        }
        this.fields = Collections.unmodifiableList(collected);
        this.byJsonName = Collections.unmodifiableMap(names);
    }

    public static SchemaFields of(Class<?> type) {
        return CACHE.computeIfAbsent(type, SchemaFields::new);
    }

    public List<Field> fields() { return fields; }

    public boolean isDeclared(String jsonName) {
        return byJsonName.containsKey(jsonName);
    }

    /**
     * True when a JSON null for the named field leaves the field at its default:
     * List and Map fields keep their empty default, and JsonObject / JsonArray
     * fields stay unset since Gson will not bind a null to them.
     */
    public boolean defaultsOnNull(String jsonName) {
        Field f = byJsonName.get(jsonName);
        if (f == null) return false;
        Class<?> t = f.getType();
        return Collection.class.isAssignableFrom(t)
                || Map.class.isAssignableFrom(t)
                || JsonObject.class.isAssignableFrom(t)
                || JsonArray.class.isAssignableFrom(t);
    }

    /**
     * Replaces {@link com.google.gson.JsonNull} in dynamic-value fields with Java null,
     * so that an explicit JSON null and an unset field read back identically.
     */
    public void clearJsonNulls(Object entity) {
        for (Field f : fields) {
            if (f.getType() != JsonElement.class) continue;
            JsonElement value = (JsonElement) read(f, entity);
            if (value != null && value.isJsonNull()) {
                try {
                    f.set(entity, null);
                } catch (IllegalAccessException e) {
                    throw new IllegalStateException("Cannot write field " + f.getName(), e);
                }
            }
        }
    }

    public static Object read(Field field, Object entity) {
        try {
            return field.get(entity);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read field " + field.getName(), e);
        }
    }
}
