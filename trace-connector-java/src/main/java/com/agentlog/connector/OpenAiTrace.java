package com.agentlog.connector;

import com.agentlog.ontology.schema.ValidationException;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bound form of an OpenAI-style agent trace document.
 *
 * Every field is optional. Each {@link Step} also keeps the raw JSON object it
 * was bound from, since the converted step records it verbatim.
 */
public class OpenAiTrace {

    private static final Gson GSON = new Gson();

    @SerializedName("id")         public String id;
    @SerializedName("agent_id")   public String agentId;
    @SerializedName("model")      public String model;
    @SerializedName("config")     public JsonElement config;
    @SerializedName("started_at") public String startedAt;
    @SerializedName("ended_at")   public String endedAt;
    @SerializedName("status")     public String status;

    // bound by hand in from(), so that each step keeps its raw object
    public transient List<Step> steps;

    public List<Step> getSteps() {
        return steps != null ? steps : Collections.emptyList();
    }

    public static class Step {
        @SerializedName("id")        public String id;
        @SerializedName("type")      public String type;
        @SerializedName("timestamp") public String timestamp;
        @SerializedName("role")      public String role;
        @SerializedName("content")   public JsonElement content;
        @SerializedName("tool_name") public String toolName;
        @SerializedName("input")     public JsonElement input;
        @SerializedName("output")    public JsonElement output;

        /** The step object exactly as it appeared in the trace. */
        public transient JsonObject raw;

        public boolean isMessage() { return "message".equals(type); }
        public boolean isTool()    { return "tool".equals(type); }
    }

    /**
     * Binds {@code document}. A {@code steps} value that is not an array, or a
     * step that is not an object, is rejected with its JSON path.
     *
     * @throws ValidationException if a field has a JSON type that cannot be bound
     */
    public static OpenAiTrace from(JsonObject document) {
        OpenAiTrace trace = bind(document, OpenAiTrace.class, "$");
        trace.steps = new ArrayList<>();
        JsonElement rawSteps = document.get("steps");
        if (rawSteps == null || rawSteps.isJsonNull()) {
            return trace;
        }
        if (!rawSteps.isJsonArray()) {
            throw ValidationException.typeMismatch("OpenAiTrace", "$.steps", "expected a JSON array", null);
        }
        JsonArray array = rawSteps.getAsJsonArray();
        for (int i = 0; i < array.size(); i++) {
            String path = "$.steps[" + i + "]";
            JsonElement element = array.get(i);
            if (!element.isJsonObject()) {
                throw ValidationException.typeMismatch("OpenAiTrace.Step", path, "expected a JSON object", null);
            }
            Step step = bind(element.getAsJsonObject(), Step.class, path);
            step.raw = element.getAsJsonObject();
            trace.steps.add(step);
        }
        return trace;
    }

    private static <T> T bind(JsonObject object, Class<T> type, String path) {
        try {
            return GSON.fromJson(object, type);
        } catch (JsonParseException e) {
            throw ValidationException.typeMismatch(type.getSimpleName(), path, e.getMessage(), e);
        }
    }
}
