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
 * Oversight layer: anomalies, risks, human review and interventions.
 * These are containers only; nothing here detects or scores anything.
 */
public final class OversightLayer {

    private OversightLayer() {}

    public enum AnomalyType implements OntologyEnum {
        BEHAVIORAL("behavioral"),
        PERFORMANCE("performance"),
        RESOURCE("resource"),
        SECURITY("security"),
        COMPLIANCE("compliance"),
        DATA_QUALITY("data-quality"),
        SYSTEM("system");

        private final String tag;
        AnomalyType(String tag) { this.tag = tag; }
        @Override public String tag() { return tag; }
    }

    public enum RiskLevel implements OntologyEnum {
        CRITICAL("critical"),
        HIGH("high"),
        MEDIUM("medium"),
        LOW("low"),
        MINIMAL("minimal");

        private final String tag;
        RiskLevel(String tag) { this.tag = tag; }
        @Override public String tag() { return tag; }
    }

    public enum InterventionType implements OntologyEnum {
        HUMAN_REVIEW("human-review"),
        AUTOMATIC_CORRECTION("automatic-correction"),
        PAUSE_EXECUTION("pause-execution"),
        ROLLBACK("rollback"),
        PARAMETER_ADJUSTMENT("parameter-adjustment"),
        CAPABILITY_RESTRICTION("capability-restriction"),
        SHUTDOWN("shutdown");

        private final String tag;
        InterventionType(String tag) { this.tag = tag; }
        @Override public String tag() { return tag; }
    }

    public static class Anomaly extends OpenEntity {
        @SerializedName("id")                         public String id;
        @SerializedName("type")                       public AnomalyType type;
        @SerializedName("severity")                   public RiskLevel severity;
        @SerializedName("detected_at")                public OffsetDateTime detectedAt;
        @SerializedName("component")                  public String component;
        @SerializedName("description")                public String description;
        @SerializedName("evidence")                   public List<JsonObject> evidence = new ArrayList<>();
        @SerializedName("confidence")                 public Double confidence;
        @SerializedName("false_positive_probability") public double falsePositiveProbability;
        @SerializedName("related_anomalies")          public List<String> relatedAnomalies = new ArrayList<>();

        @Override
        public void validate() {
            require("id", id);
            require("type", type);
            require("severity", severity);
            require("detected_at", detectedAt);
            require("component", component);
            require("description", description);
            require("confidence", confidence);
        }
    }

    public static class Risk extends OpenEntity {
        @SerializedName("id")                  public String id;
        @SerializedName("name")                public String name;
        @SerializedName("description")         public String description;
        @SerializedName("level")               public RiskLevel level;
        @SerializedName("probability")         public double probability;
        @SerializedName("impact")              public double impact;
        @SerializedName("risk_score")          public double riskScore;
        @SerializedName("affected_components") public List<String> affectedComponents = new ArrayList<>();
        @SerializedName("mitigation_options")  public List<JsonObject> mitigationOptions = new ArrayList<>();
        @SerializedName("monitoring_required") public boolean monitoringRequired = true;

        @Override
        public void validate() {
            require("id", id);
            require("name", name);
            require("description", description);
            require("level", level);
        }
    }

    public static class PerformanceMetric extends OpenEntity {
        @SerializedName("id")                 public String id;
        @SerializedName("name")               public String name;
        @SerializedName("category")           public String category;
        @SerializedName("value")              public Double value;
        @SerializedName("unit")               public String unit;
        @SerializedName("baseline")           public Double baseline;
        @SerializedName("threshold_warning")  public Double thresholdWarning;
        @SerializedName("threshold_critical") public Double thresholdCritical;
        @SerializedName("trend")              public String trend = "stable";

        @Override
        public void validate() {
            require("id", id);
            require("name", name);
            require("category", category);
            require("value", value);
            require("unit", unit);
            require("baseline", baseline);
            require("threshold_warning", thresholdWarning);
            require("threshold_critical", thresholdCritical);
        }
    }

    public static class PerformanceReport extends OpenEntity {
        @SerializedName("id")                         public String id;
        @SerializedName("timestamp")                  public OffsetDateTime timestamp;
        @SerializedName("time_window")                public Double timeWindow;  // seconds
        @SerializedName("metrics")                    public List<PerformanceMetric> metrics = new ArrayList<>();
        @SerializedName("efficiency_score")           public Double efficiencyScore;
        @SerializedName("bottlenecks")                public List<String> bottlenecks = new ArrayList<>();
        @SerializedName("optimization_opportunities") public List<String> optimizationOpportunities = new ArrayList<>();
        @SerializedName("comparison_to_baseline")     public Map<String, Double> comparisonToBaseline = new LinkedHashMap<>();

        @Override
        public void validate() {
            require("id", id);
            require("timestamp", timestamp);
            require("time_window", timeWindow);
            require("efficiency_score", efficiencyScore);
            requireNoNulls("metrics", metrics);
        }
    }

    /** Audit log entry; {@code immutable} defaults to true. */
    public static class AuditEvent extends OpenEntity {
        @SerializedName("id")              public String id;
        @SerializedName("timestamp")       public OffsetDateTime timestamp;
        @SerializedName("event_type")      public String eventType;
        @SerializedName("actor_id")        public String actorId;
        @SerializedName("action")          public String action;
        @SerializedName("target")          public String target;
        @SerializedName("result")          public String result;
        @SerializedName("details")         public Map<String, JsonElement> details = new LinkedHashMap<>();
        @SerializedName("compliance_tags") public List<String> complianceTags = new ArrayList<>();
        @SerializedName("immutable")       public boolean immutable = true;

        @Override
        public void validate() {
            require("id", id);
            require("timestamp", timestamp);
            require("event_type", eventType);
            require("actor_id", actorId);
            require("action", action);
            require("target", target);
            require("result", result);
        }
    }

    public static class ComplianceCheck extends OpenEntity {
        @SerializedName("id")                   public String id;
        @SerializedName("name")                 public String name;
        @SerializedName("regulation")           public String regulation;
        @SerializedName("timestamp")            public OffsetDateTime timestamp;
        @SerializedName("passed")               public Boolean passed;
        @SerializedName("violations")           public List<JsonObject> violations = new ArrayList<>();
        @SerializedName("evidence")             public List<String> evidence = new ArrayList<>();
        @SerializedName("remediation_required") public boolean remediationRequired;

        @Override
        public void validate() {
            require("id", id);
            require("name", name);
            require("regulation", regulation);
            require("timestamp", timestamp);
            require("passed", passed);
        }
    }

    public static class HumanReviewRequest extends OpenEntity {
        @SerializedName("id")               public String id;
        @SerializedName("timestamp")        public OffsetDateTime timestamp;
        @SerializedName("urgency")          public RiskLevel urgency;
        @SerializedName("reason")           public String reason;
        @SerializedName("context")          public Map<String, JsonElement> context = new LinkedHashMap<>();
        @SerializedName("decision_options") public List<JsonObject> decisionOptions = new ArrayList<>();
        @SerializedName("timeout")          public Double timeout;  // seconds
        @SerializedName("assigned_to")      public String assignedTo;
        @SerializedName("status")           public String status = "pending";

        @Override
        public void validate() {
            require("id", id);
            require("timestamp", timestamp);
            require("urgency", urgency);
            require("reason", reason);
        }
    }

    public static class HumanIntervention extends OpenEntity {
        @SerializedName("id")                 public String id;
        @SerializedName("request_id")         public String requestId;
        @SerializedName("reviewer_id")        public String reviewerId;
        @SerializedName("timestamp")          public OffsetDateTime timestamp;
        @SerializedName("decision")           public String decision;
        @SerializedName("rationale")          public String rationale;
        @SerializedName("actions_taken")      public List<JsonObject> actionsTaken = new ArrayList<>();
        @SerializedName("override_automated") public boolean overrideAutomated;
        @SerializedName("feedback_to_system") public Map<String, JsonElement> feedbackToSystem = new LinkedHashMap<>();

        @Override
        public void validate() {
            require("id", id);
            require("request_id", requestId);
            require("reviewer_id", reviewerId);
            require("timestamp", timestamp);
            require("decision", decision);
            require("rationale", rationale);
        }
    }

    public static class EscalationPolicy extends OpenEntity {
        @SerializedName("id")                    public String id;
        @SerializedName("name")                  public String name;
        @SerializedName("triggers")              public List<JsonObject> triggers = new ArrayList<>();
        @SerializedName("escalation_levels")     public List<JsonObject> escalationLevels = new ArrayList<>();
        @SerializedName("notification_channels") public List<String> notificationChannels = new ArrayList<>();
        @SerializedName("auto_escalate_timeout") public Double autoEscalateTimeout;  // seconds
        @SerializedName("active")                public boolean active = true;

        @Override
        public void validate() {
            require("id", id);
            require("name", name);
            require("auto_escalate_timeout", autoEscalateTimeout);
        }
    }

    public static class InterventionAction extends OpenEntity {
        @SerializedName("id")                 public String id;
        @SerializedName("type")               public InterventionType type;
        @SerializedName("trigger")            public String trigger;
        @SerializedName("timestamp")          public OffsetDateTime timestamp;
        @SerializedName("target_component")   public String targetComponent;
        @SerializedName("parameters")         public Map<String, JsonElement> parameters = new LinkedHashMap<>();
        @SerializedName("expected_outcome")   public String expectedOutcome;
        @SerializedName("actual_outcome")     public String actualOutcome;
        @SerializedName("success")            public Boolean success;
        @SerializedName("rollback_available") public boolean rollbackAvailable;

        @Override
        public void validate() {
            require("id", id);
            require("type", type);
            require("trigger", trigger);
            require("timestamp", timestamp);
            require("target_component", targetComponent);
            require("expected_outcome", expectedOutcome);
        }
    }

    public static class OversightSnapshot extends OpenEntity {
        @SerializedName("timestamp")            public OffsetDateTime timestamp;
        @SerializedName("active_anomalies")     public List<Anomaly> activeAnomalies = new ArrayList<>();
        @SerializedName("current_risks")        public List<Risk> currentRisks = new ArrayList<>();
        @SerializedName("performance_summary")  public Map<String, Double> performanceSummary = new LinkedHashMap<>();
        @SerializedName("pending_reviews")      public List<HumanReviewRequest> pendingReviews = new ArrayList<>();
        @SerializedName("recent_interventions") public List<InterventionAction> recentInterventions = new ArrayList<>();
        @SerializedName("compliance_status")    public Map<String, Boolean> complianceStatus = new LinkedHashMap<>();
        @SerializedName("oversight_health")     public Double oversightHealth;
        @SerializedName("recommendations")      public List<String> recommendations = new ArrayList<>();

        @Override
        public void validate() {
            require("timestamp", timestamp);
            require("oversight_health", oversightHealth);
        }
    }
}
