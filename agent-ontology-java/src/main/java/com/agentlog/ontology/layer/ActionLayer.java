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
 * Action layer: planned actions, their execution records, and the tool calls
 * made while executing them.
 */
public final class ActionLayer {

    private ActionLayer() {}

    public enum ActionType implements OntologyEnum {
        EXTERNAL("external"),
        INTERNAL("internal"),
        SOCIAL("social"),
        META("meta");

        private final String tag;
        ActionType(String tag) { this.tag = tag; }
        @Override public String tag() { return tag; }
    }

    public enum ActionCategory implements OntologyEnum {
        COMMUNICATION("communication"),
        COMPUTATION("computation"),
        DATA_MANIPULATION("data-manipulation"),
        RESOURCE_ACCESS("resource-access"),
        TOOL_USE("tool-use"),
        DECISION_MAKING("decision-making"),
        LEARNING("learning"),
        MONITORING("monitoring");

        private final String tag;
        ActionCategory(String tag) { this.tag = tag; }
        @Override public String tag() { return tag; }
    }

    public enum ActionStatus implements OntologyEnum {
        PLANNED("planned"),
        VALIDATED("validated"),
        EXECUTING("executing"),
        COMPLETED("completed"),
        FAILED("failed"),
        CANCELLED("cancelled"),
        SUSPENDED("suspended");

        private final String tag;
        ActionStatus(String tag) { this.tag = tag; }
        @Override public String tag() { return tag; }
    }

    public enum ExecutionMode implements OntologyEnum {
        SYNCHRONOUS("synchronous"),
        ASYNCHRONOUS("asynchronous"),
        PARALLEL("parallel"),
        SEQUENTIAL("sequential"),
        CONDITIONAL("conditional"),
        ITERATIVE("iterative");

        private final String tag;
        ExecutionMode(String tag) { this.tag = tag; }
        @Override public String tag() { return tag; }
    }

    public static class ActionPlan extends OpenEntity {
        @SerializedName("id")               public String id;
        @SerializedName("name")             public String name;
        @SerializedName("type")             public ActionType type;
        @SerializedName("category")         public ActionCategory category;
        @SerializedName("description")      public String description;
        @SerializedName("goal_id")          public String goalId;
        @SerializedName("plan_id")          public String planId;
        @SerializedName("parameters")       public Map<String, JsonElement> parameters = new LinkedHashMap<>();
        @SerializedName("preconditions")    public List<JsonObject> preconditions = new ArrayList<>();
        @SerializedName("expected_effects") public List<JsonObject> expectedEffects = new ArrayList<>();
        @SerializedName("priority")         public int priority;
        @SerializedName("deadline")         public OffsetDateTime deadline;

        @Override
        public void validate() {
            require("id", id);
            require("name", name);
            require("type", type);
            require("category", category);
            require("description", description);
        }
    }

    /**
     * Tool or API call. {@code actionExecutionId} points back at the owning
     * {@link ActionExecution}.
     */
    /** Ordered group of action ids executed under one mode. */
    public static class ActionSequence extends OpenEntity {
        @SerializedName("id")                   public String id;
        @SerializedName("name")                 public String name;
        @SerializedName("action_ids")           public List<String> actionIds = new ArrayList<>();
        @SerializedName("execution_mode")       public ExecutionMode executionMode;
        @SerializedName("dependencies")         public Map<String, List<String>> dependencies = new LinkedHashMap<>();
        @SerializedName("branching_conditions") public List<JsonObject> branchingConditions = new ArrayList<>();
        @SerializedName("loop_conditions")      public List<JsonObject> loopConditions = new ArrayList<>();

        @Override
        public void validate() {
            require("id", id);
            require("name", name);
            requireNonEmpty("action_ids", actionIds);
            require("execution_mode", executionMode);
        }
    }

    public static class ActionValidation extends OpenEntity {
        @SerializedName("id")                public String id;
        @SerializedName("action_id")         public String actionId;
        @SerializedName("timestamp")         public OffsetDateTime timestamp;
        @SerializedName("is_valid")          public Boolean isValid;
        @SerializedName("validation_checks") public List<JsonObject> validationChecks = new ArrayList<>();
        @SerializedName("violations")        public List<String> violations = new ArrayList<>();
        @SerializedName("warnings")          public List<String> warnings = new ArrayList<>();
        @SerializedName("suggestions")       public List<String> suggestions = new ArrayList<>();

        @Override
        public void validate() {
            require("id", id);
            require("action_id", actionId);
            require("timestamp", timestamp);
            require("is_valid", isValid);
        }
    }

    public static class ToolInvocation extends OpenEntity {
        @SerializedName("id")                  public String id;
        @SerializedName("tool_name")           public String toolName;
        @SerializedName("tool_version")        public String toolVersion;
        @SerializedName("action_execution_id") public String actionExecutionId;
        @SerializedName("input_parameters")    public Map<String, JsonElement> inputParameters = new LinkedHashMap<>();
        @SerializedName("output_data")         public JsonElement outputData;
        @SerializedName("status_code")         public Integer statusCode;
        @SerializedName("error_message")       public String errorMessage;
        @SerializedName("start_time")          public OffsetDateTime startTime;
        @SerializedName("end_time")            public OffsetDateTime endTime;

        @Override
        public void validate() {
            require("id", id);
            require("tool_name", toolName);
            require("action_execution_id", actionExecutionId);
            require("start_time", startTime);
        }
    }

    public static class ActionExecution extends OpenEntity {
        @SerializedName("id")                public String id;
        @SerializedName("action_plan_id")    public String actionPlanId;
        @SerializedName("status")            public ActionStatus status;
        @SerializedName("start_time")        public OffsetDateTime startTime;
        @SerializedName("end_time")          public OffsetDateTime endTime;
        @SerializedName("duration")          public Double duration;  // seconds
        @SerializedName("executor_id")       public String executorId;
        @SerializedName("actual_parameters") public Map<String, JsonElement> actualParameters = new LinkedHashMap<>();
        @SerializedName("results")           public JsonElement results;
        @SerializedName("side_effects")      public List<JsonObject> sideEffects = new ArrayList<>();
        @SerializedName("resource_usage")    public Map<String, JsonElement> resourceUsage = new LinkedHashMap<>();
        @SerializedName("tool_invocations")  public List<ToolInvocation> toolInvocations = new ArrayList<>();

        @Override
        public void validate() {
            require("id", id);
            require("action_plan_id", actionPlanId);
            require("status", status);
            require("start_time", startTime);
            require("executor_id", executorId);
        }
    }

    public static class ActionSnapshot extends OpenEntity {
        @SerializedName("timestamp")            public OffsetDateTime timestamp;
        @SerializedName("planned_actions")      public List<ActionPlan> plannedActions = new ArrayList<>();
        @SerializedName("executing_actions")    public List<ActionExecution> executingActions = new ArrayList<>();
        @SerializedName("completed_actions")    public List<ActionExecution> completedActions = new ArrayList<>();
        @SerializedName("failed_actions")       public List<ActionExecution> failedActions = new ArrayList<>();
        @SerializedName("action_queue_size")    public int actionQueueSize;
        @SerializedName("resource_utilization") public Map<String, Double> resourceUtilization = new LinkedHashMap<>();

        @Override
        public void validate() {
            require("timestamp", timestamp);
        }
    }
}
