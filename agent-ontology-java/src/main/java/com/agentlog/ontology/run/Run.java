package com.agentlog.ontology.run;

import com.agentlog.ontology.layer.IdentityLayer;
import com.agentlog.ontology.layer.StateLayer;
import com.agentlog.ontology.schema.OpenEntity;
import com.google.gson.JsonElement;
import com.google.gson.annotations.SerializedName;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One end-to-end execution of an agent: the agent identity, its state at
 * start and end, and the ordered forest of steps in between.
 *
 * The {@code total_*} counters are filled in once by whoever builds the run
 * and are not kept in sync when steps are added afterwards.
 */
public class Run extends OpenEntity {

    @SerializedName("id")                  public String id;
    @SerializedName("name")                public String name;
    @SerializedName("description")         public String description;

    @SerializedName("agent")               public IdentityLayer.AgentInstance agent;

    @SerializedName("start_time")          public OffsetDateTime startTime;
    @SerializedName("end_time")            public OffsetDateTime endTime;
    @SerializedName("duration")            public Double duration;  // seconds
    @SerializedName("status")              public RunStatus status = RunStatus.RUNNING;
    @SerializedName("success")             public Boolean success;
    @SerializedName("error_message")       public String errorMessage;

    @SerializedName("initial_state")       public StateLayer.CompleteState initialState;
    @SerializedName("initial_goals")       public List<String> initialGoals = new ArrayList<>();
    @SerializedName("initial_context")     public Map<String, JsonElement> initialContext = new LinkedHashMap<>();

    @SerializedName("final_state")         public StateLayer.CompleteState finalState;
    @SerializedName("achieved_goals")      public List<String> achievedGoals = new ArrayList<>();
    @SerializedName("final_context")       public Map<String, JsonElement> finalContext = new LinkedHashMap<>();

    @SerializedName("steps")               public List<Step> steps = new ArrayList<>();

    @SerializedName("total_observations")  public int totalObservations;
    @SerializedName("total_decisions")     public int totalDecisions;
    @SerializedName("total_actions")       public int totalActions;
    @SerializedName("total_messages")      public int totalMessages;
    @SerializedName("total_anomalies")     public int totalAnomalies;
    @SerializedName("total_interventions") public int totalInterventions;

    @SerializedName("performance_metrics") public Map<String, Double> performanceMetrics = new LinkedHashMap<>();
    @SerializedName("resource_usage")      public Map<String, JsonElement> resourceUsage = new LinkedHashMap<>();

    @SerializedName("risk_events")         public List<String> riskEvents = new ArrayList<>();        // risk ids
    @SerializedName("compliance_checks")   public List<String> complianceChecks = new ArrayList<>();  // compliance check ids
    @SerializedName("human_reviews")       public List<String> humanReviews = new ArrayList<>();      // review request ids

    @SerializedName("tags")                public List<String> tags = new ArrayList<>();
    @SerializedName("metadata")            public Map<String, JsonElement> metadata = new LinkedHashMap<>();

    public Step addStep(Step step) {
        steps.add(step);
        return step;
    }

    @Override
    public void validate() {
        require("id", id);
        require("name", name);
        require("agent", agent);
        require("start_time", startTime);
        require("status", status);
        requireNoNulls("steps", steps);
    }
}
