package com.agentlog.ontology.layer;

import com.agentlog.ontology.schema.OntologyEnum;
import com.agentlog.ontology.schema.OpenEntity;
import com.google.gson.JsonElement;
import com.google.gson.annotations.SerializedName;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Perception layer: sensors, the raw signals they capture, and the observations
 * derived from those signals.
 */
public final class PerceptionLayer {

    private PerceptionLayer() {}

    public enum SensorType implements OntologyEnum {
        TEXT_INPUT("text-input"),
        DOCUMENT_INPUT("document-input"),
        API_INPUT("api-input"),
        DATABASE_INPUT("database-input"),
        FILE_SYSTEM_INPUT("file-system-input"),
        NETWORK_INPUT("network-input"),
        ENVIRONMENT_STATE("environment-state"),
        AGENT_STATE("agent-state"),
        USER_FEEDBACK("user-feedback"),
        SYSTEM_METRICS("system-metrics");

        private final String tag;
        SensorType(String tag) { this.tag = tag; }
        @Override public String tag() { return tag; }
    }

    public enum SignalType implements OntologyEnum {
        TEXT("text"),
        NUMERIC("numeric"),
        BINARY("binary"),
        STRUCTURED("structured"),
        UNSTRUCTURED("unstructured"),
        TIME_SERIES("time-series"),
        EVENT("event");

        private final String tag;
        SignalType(String tag) { this.tag = tag; }
        @Override public String tag() { return tag; }
    }

    public static class Sensor extends OpenEntity {
        @SerializedName("id")            public String id;
        @SerializedName("name")          public String name;
        @SerializedName("type")          public SensorType type;
        @SerializedName("configuration") public Map<String, JsonElement> configuration = new LinkedHashMap<>();
        @SerializedName("active")        public boolean active = true;
        @SerializedName("sampling_rate") public Double samplingRate;  // Hz
        @SerializedName("filters")       public List<String> filters = new ArrayList<>();

        @Override
        public void validate() {
            require("id", id);
            require("name", name);
            require("type", type);
        }
    }

    public static class RawSignal extends OpenEntity {
        @SerializedName("id")        public String id;
        @SerializedName("sensor_id") public String sensorId;
        @SerializedName("type")      public SignalType type;
        @SerializedName("data")      public JsonElement data;
        @SerializedName("timestamp") public OffsetDateTime timestamp;
        @SerializedName("quality")   public double quality = 1.0;
        @SerializedName("metadata")  public Map<String, JsonElement> metadata = new LinkedHashMap<>();

        @Override
        public void validate() {
            require("id", id);
            require("sensor_id", sensorId);
            require("type", type);
            require("timestamp", timestamp);
        }
    }

    /**
     * Processed observation. {@code signalIds} reference {@link RawSignal} ids.
     */
    public static class Observation extends OpenEntity {
        @SerializedName("id")           public String id;
        @SerializedName("processor_id") public String processorId;
        @SerializedName("signal_ids")   public List<String> signalIds = new ArrayList<>();
        @SerializedName("type")         public String type;
        @SerializedName("content")      public JsonElement content;
        @SerializedName("confidence")   public double confidence = 1.0;
        @SerializedName("timestamp")    public OffsetDateTime timestamp;
        @SerializedName("metadata")     public Map<String, JsonElement> metadata = new LinkedHashMap<>();

        @Override
        public void validate() {
            require("id", id);
            require("processor_id", processorId);
            require("type", type);
            require("timestamp", timestamp);
        }
    }

    public static class ContextFilter extends OpenEntity {
        @SerializedName("id")       public String id;
        @SerializedName("name")     public String name;
        @SerializedName("criteria") public Map<String, JsonElement> criteria = new LinkedHashMap<>();
        @SerializedName("priority") public int priority;
        @SerializedName("active")   public boolean active = true;

        @Override
        public void validate() {
            require("id", id);
            require("name", name);
        }
    }

    public static class PerceptionSnapshot extends OpenEntity {
        @SerializedName("timestamp")             public OffsetDateTime timestamp;
        @SerializedName("active_sensors")        public List<Sensor> activeSensors = new ArrayList<>();
        @SerializedName("recent_signals")        public List<RawSignal> recentSignals = new ArrayList<>();
        @SerializedName("current_observations")  public List<Observation> currentObservations = new ArrayList<>();
        @SerializedName("active_filters")        public List<ContextFilter> activeFilters = new ArrayList<>();
        @SerializedName("processing_queue_size") public int processingQueueSize;

        @Override
        public void validate() {
            require("timestamp", timestamp);
        }
    }
}
