package com.agentlog.ontology.serial;

import com.agentlog.ontology.run.Run;
import com.agentlog.ontology.schema.OpenEntity;
import com.agentlog.ontology.schema.ValidationException;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Converts runs (and any other ontology entity) to and from JSON documents.
 *
 * {@link #toDocument(Run)} and {@link #fromDocument(JsonObject)} are exact
 * inverses: every declared field is written, unset ones as explicit null,
 * enums as their string tag, timestamps as ISO-8601 with offset, and
 * unrecognized keys carried through unchanged.
 *
 * Instances are immutable and may be shared.
 */
public class OntologySerializer {

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final Gson gson;
    private final Gson prettyGson;

    public OntologySerializer() {
        this.gson = new GsonBuilder()
                .registerTypeAdapterFactory(new OpenEntityTypeAdapterFactory())
                .registerTypeAdapterFactory(new OntologyEnumTypeAdapterFactory())
                .registerTypeAdapter(OffsetDateTime.class, new OffsetDateTimeAdapter())
                .serializeNulls()
                .disableHtmlEscaping()
                .create();
        this.prettyGson = gson.newBuilder().setPrettyPrinting().create();
    }

    public JsonObject toDocument(Run run) {
        return toDocument((OpenEntity) run);
    }

    public JsonObject toDocument(OpenEntity entity) {
        Objects.requireNonNull(entity, "entity");
        return gson.toJsonTree(entity, entity.getClass()).getAsJsonObject();
    }

    /**
     * @throws ValidationException            if a required field is missing or a value has the wrong type
     * @throws com.agentlog.ontology.schema.MalformedTimestampException if a timestamp cannot be parsed
     */
    public Run fromDocument(JsonObject document) {
        return fromDocument(document, Run.class);
    }

    public <T extends OpenEntity> T fromDocument(JsonObject document, Class<T> type) {
        Objects.requireNonNull(document, "document");
        return gson.fromJson(document.deepCopy(), type);
    }

    /** Pretty-printed JSON text of {@code run}. */
    public String toJson(Run run) {
        return prettyGson.toJson(toDocument(run));
    }

    public Run fromJson(String json) {
        JsonElement parsed;
        try {
            parsed = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new SerializerException("Run document is not valid JSON: " + e.getMessage(), e);
        }
        if (!parsed.isJsonObject()) {
            throw ValidationException.typeMismatch("Run", "$", "expected a JSON object", null);
        }
        return fromDocument(parsed.getAsJsonObject());
    }
}
