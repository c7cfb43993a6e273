package com.agentlog.ontology.schema;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;

import java.lang.reflect.Field;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base of every ontology record.
 *
 * The schema is open: keys a reader does not recognize are kept in
 * {@link #extraFields} in input order and written back after the declared
 * fields. Equality is structural over all declared fields plus the extra fields;
 * a dynamic field holding {@link JsonNull} compares equal to an unset one.
 */
public abstract class OpenEntity {

    /** Unrecognized JSON keys, preserved verbatim. Not a declared field. */
    public transient Map<String, JsonElement> extraFields = new LinkedHashMap<>();

    /**
     * Checks required fields and closed-set constraints of this entity only;
     * nested entities are checked by their own {@code validate()}.
     *
     * @throws ValidationException naming the entity and field at fault
     */
    public void validate() {}

    protected final void require(String field, Object value) {
        if (value == null) {
            throw ValidationException.missingField(getClass().getSimpleName(), field);
        }
    }

    protected final void requireNonEmpty(String field, Collection<?> value) {
        require(field, value);
        if (value.isEmpty()) {
            throw ValidationException.invalid(getClass().getSimpleName(), field, "must not be empty");
        }
    }

    protected final void requireNoNulls(String field, Collection<?> value) {
        if (value != null && value.contains(null)) {
            throw ValidationException.invalid(getClass().getSimpleName(), field, "must not contain null entries");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        for (Field f : SchemaFields.of(getClass()).fields()) {
            if (!Objects.equals(valueOf(f, this), valueOf(f, o))) return false;
        }
        return Objects.equals(extraFields, ((OpenEntity) o).extraFields);
    }

    @Override
    public int hashCode() {
        int h = getClass().hashCode();
        for (Field f : SchemaFields.of(getClass()).fields()) {
            h = 31 * h + Objects.hashCode(valueOf(f, this));
        }
        return 31 * h + Objects.hashCode(extraFields);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append('{');
        boolean first = true;
        for (Field f : SchemaFields.of(getClass()).fields()) {
            Object value = valueOf(f, this);
            if (value == null) continue;
            if (!first) sb.append(", ");
            sb.append(f.getName()).append('=').append(value);
            first = false;
        }
        return sb.append('}').toString();
    }

    private static Object valueOf(Field f, Object entity) {
        Object value = SchemaFields.read(f, entity);
        return value instanceof JsonNull ? null : value;
    }
}
