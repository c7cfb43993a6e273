package com.agentlog.ontology.layer;

import com.agentlog.ontology.schema.OntologyEnum;
import com.agentlog.ontology.schema.OpenEntity;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.annotations.SerializedName;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State layer. {@link CompleteState} bundles the four state dimensions
 * (agent, execution, cognitive, perceptual) at one instant.
 */
public final class StateLayer {

    private StateLayer() {}

    public enum AgentStatus implements OntologyEnum {
        INITIALIZING("initializing"),
        READY("ready"),
        ACTIVE("active"),
        BUSY("busy"),
        PAUSED("paused"),
        ERROR("error"),
        SHUTTING_DOWN("shutting-down"),
        TERMINATED("terminated");

        private final String tag;
        AgentStatus(String tag) { this.tag = tag; }
        @Override public String tag() { return tag; }
    }

    public enum ExecutionPhase implements OntologyEnum {
        PERCEPTION("perception"),
        REASONING("reasoning"),
        PLANNING("planning"),
        EXECUTION("execution"),
        MONITORING("monitoring"),
        LEARNING("learning"),
        IDLE("idle");

        private final String tag;
        ExecutionPhase(String tag) { this.tag = tag; }
        @Override public String tag() { return tag; }
    }

    public static class AgentState extends OpenEntity {
        @SerializedName("id")                  public String id;
        @SerializedName("agent_id")            public String agentId;
        @SerializedName("status")              public AgentStatus status;
        @SerializedName("health_score")        public double healthScore = 1.0;
        @SerializedName("uptime")              public double uptime;  // seconds
        @SerializedName("last_activity")       public OffsetDateTime lastActivity;
        @SerializedName("active_capabilities") public List<String> activeCapabilities = new ArrayList<>();
        @SerializedName("resource_allocation") public Map<String, JsonElement> resourceAllocation = new LinkedHashMap<>();
        @SerializedName("configuration_hash")  public String configurationHash;

        @Override
        public void validate() {
            require("id", id);
            require("agent_id", agentId);
            require("status", status);
            require("last_activity", lastActivity);
            require("configuration_hash", configurationHash);
        }
    }

    public static class ExecutionState extends OpenEntity {
        @SerializedName("id")                  public String id;
        @SerializedName("phase")               public ExecutionPhase phase;
        @SerializedName("active_tasks")        public List<String> activeTasks = new ArrayList<>();
        @SerializedName("pending_actions")     public List<String> pendingActions = new ArrayList<>();
        @SerializedName("execution_stack")     public List<JsonObject> executionStack = new ArrayList<>();
        @SerializedName("resource_usage")      public Map<String, Double> resourceUsage = new LinkedHashMap<>();
        @SerializedName("performance_metrics") public Map<String, Double> performanceMetrics = new LinkedHashMap<>();
        @SerializedName("bottlenecks")         public List<String> bottlenecks = new ArrayList<>();

        @Override
        public void validate() {
            require("id", id);
            require("phase", phase);
        }
    }

    public static class CognitiveState extends OpenEntity {
        @SerializedName("id")               public String id;
        @SerializedName("attention_focus")  public List<String> attentionFocus = new ArrayList<>();
        @SerializedName("working_memory")   public List<String> workingMemory = new ArrayList<>();
        @SerializedName("active_goals")     public List<String> activeGoals = new ArrayList<>();
        @SerializedName("active_plans")     public List<String> activePlans = new ArrayList<>();
        @SerializedName("reasoning_depth")  public int reasoningDepth;
        @SerializedName("cognitive_load")   public double cognitiveLoad;
        @SerializedName("learning_enabled") public boolean learningEnabled = true;
        @SerializedName("exploration_rate") public double explorationRate = 0.1;

        @Override
        public void validate() {
            require("id", id);
        }
    }

    public static class PerceptualState extends OpenEntity {
        @SerializedName("id")                       public String id;
        @SerializedName("active_sensors")           public List<String> activeSensors = new ArrayList<>();
        @SerializedName("sensor_readings")          public Map<String, JsonElement> sensorReadings = new LinkedHashMap<>();
        @SerializedName("observation_buffer")       public List<String> observationBuffer = new ArrayList<>();
        @SerializedName("attention_filters")        public List<String> attentionFilters = new ArrayList<>();
        @SerializedName("signal_quality")           public Map<String, Double> signalQuality = new LinkedHashMap<>();
        @SerializedName("anomaly_detection_active") public boolean anomalyDetectionActive = true;

        @Override
        public void validate() {
            require("id", id);
        }
    }

    public static class HistoricalState extends OpenEntity {
        @SerializedName("id")                  public String id;
        @SerializedName("state_history")       public List<String> stateHistory = new ArrayList<>();
        @SerializedName("event_log")           public List<JsonObject> eventLog = new ArrayList<>();
        @SerializedName("performance_history") public List<JsonObject> performanceHistory = new ArrayList<>();
        @SerializedName("error_history")       public List<String> errorHistory = new ArrayList<>();
        @SerializedName("learning_history")    public List<String> learningHistory = new ArrayList<>();
        @SerializedName("checkpoint_states")   public List<JsonObject> checkpointStates = new ArrayList<>();

        @Override
        public void validate() {
            require("id", id);
        }
    }

    public static class StateTransition extends OpenEntity {
        @SerializedName("id")            public String id;
        @SerializedName("from_state_id") public String fromStateId;
        @SerializedName("to_state_id")   public String toStateId;
        @SerializedName("trigger")       public String trigger;
        @SerializedName("conditions")    public List<JsonObject> conditions = new ArrayList<>();
        @SerializedName("timestamp")     public OffsetDateTime timestamp;
        @SerializedName("duration")      public Double duration;  // seconds
        @SerializedName("success")       public Boolean success;
        @SerializedName("side_effects")  public List<JsonObject> sideEffects = new ArrayList<>();

        @Override
        public void validate() {
            require("id", id);
            require("from_state_id", fromStateId);
            require("to_state_id", toStateId);
            require("trigger", trigger);
            require("timestamp", timestamp);
            require("duration", duration);
            require("success", success);
        }
    }

    public static class StateCheckpoint extends OpenEntity {
        @SerializedName("id")                public String id;
        @SerializedName("timestamp")         public OffsetDateTime timestamp;
        @SerializedName("reason")            public String reason;
        @SerializedName("state_snapshot")    public JsonObject stateSnapshot;
        @SerializedName("metadata")          public Map<String, JsonElement> metadata = new LinkedHashMap<>();
        @SerializedName("size_bytes")        public Long sizeBytes;
        @SerializedName("compression_ratio") public double compressionRatio = 1.0;

        @Override
        public void validate() {
            require("id", id);
            require("timestamp", timestamp);
            require("reason", reason);
            require("state_snapshot", stateSnapshot);
            require("size_bytes", sizeBytes);
        }
    }

    public static class StateConstraint extends OpenEntity {
        @SerializedName("id")              public String id;
        @SerializedName("name")            public String name;
        @SerializedName("type")            public String type;
        @SerializedName("expression")      public String expression;
        @SerializedName("severity")        public String severity = "warning";
        @SerializedName("active")          public boolean active = true;
        @SerializedName("violation_count") public int violationCount;
        @SerializedName("last_violation")  public OffsetDateTime lastViolation;

        @Override
        public void validate() {
            require("id", id);
            require("name", name);
            require("type", type);
            require("expression", expression);
        }
    }

    public static class CompleteState extends OpenEntity {
        @SerializedName("timestamp")          public OffsetDateTime timestamp;
        @SerializedName("agent_state")        public AgentState agentState;
        @SerializedName("execution_state")    public ExecutionState executionState;
        @SerializedName("cognitive_state")    public CognitiveState cognitiveState;
        @SerializedName("perceptual_state")   public PerceptualState perceptualState;
        @SerializedName("historical_summary") public Map<String, JsonElement> historicalSummary = new LinkedHashMap<>();
        @SerializedName("active_constraints") public List<StateConstraint> activeConstraints = new ArrayList<>();
        @SerializedName("health_indicators")  public Map<String, Double> healthIndicators = new LinkedHashMap<>();

        @Override
        public void validate() {
            require("timestamp", timestamp);
            require("agent_state", agentState);
            require("execution_state", executionState);
            require("cognitive_state", cognitiveState);
            require("perceptual_state", perceptualState);
        }
    }
}
