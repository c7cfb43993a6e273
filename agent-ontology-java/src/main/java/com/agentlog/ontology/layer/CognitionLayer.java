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
 * Cognition layer: reasoning, decisions, goals and plans.
 */
public final class CognitionLayer {

    private CognitionLayer() {}

    public enum ReasoningType implements OntologyEnum {
        DEDUCTIVE("deductive"),
        INDUCTIVE("inductive"),
        ABDUCTIVE("abductive"),
        PROBABILISTIC("probabilistic"),
        FUZZY("fuzzy"),
        RULE_BASED("rule-based"),
        CASE_BASED("case-based"),
        MODEL_BASED("model-based");

        private final String tag;
        ReasoningType(String tag) { this.tag = tag; }
        @Override public String tag() { return tag; }
    }

    public enum DecisionStrategy implements OntologyEnum {
        OPTIMIZATION("optimization"),
        SATISFICING("satisficing"),
        HEURISTIC("heuristic"),
        MULTI_CRITERIA("multi-criteria"),
        GAME_THEORETIC("game-theoretic"),
        CONSENSUS("consensus");

        private final String tag;
        DecisionStrategy(String tag) { this.tag = tag; }
        @Override public String tag() { return tag; }
    }

    public enum KnowledgeType implements OntologyEnum {
        DECLARATIVE("declarative"),
        PROCEDURAL("procedural"),
        EPISODIC("episodic"),
        SEMANTIC("semantic"),
        TACIT("tacit"),
        EXPLICIT("explicit");

        private final String tag;
        KnowledgeType(String tag) { this.tag = tag; }
        @Override public String tag() { return tag; }
    }

    public enum LearningType implements OntologyEnum {
        SUPERVISED("supervised"),
        UNSUPERVISED("unsupervised"),
        REINFORCEMENT("reinforcement"),
        TRANSFER("transfer"),
        FEDERATED("federated"),
        CONTINUAL("continual"),
        ONE_SHOT("one-shot"),
        ZERO_SHOT("zero-shot");

        private final String tag;
        LearningType(String tag) { this.tag = tag; }
        @Override public String tag() { return tag; }
    }

    public static class Reasoning extends OpenEntity {
        @SerializedName("id")              public String id;
        @SerializedName("type")            public ReasoningType type;
        @SerializedName("inputs")          public List<String> inputs = new ArrayList<>();  // observation ids
        @SerializedName("premises")        public List<JsonObject> premises = new ArrayList<>();
        @SerializedName("inference_steps") public List<JsonObject> inferenceSteps = new ArrayList<>();
        @SerializedName("conclusion")      public JsonElement conclusion;
        @SerializedName("confidence")      public double confidence = 1.0;
        @SerializedName("timestamp")       public OffsetDateTime timestamp;

        @Override
        public void validate() {
            require("id", id);
            require("type", type);
            require("timestamp", timestamp);
        }
    }

    public static class Decision extends OpenEntity {
        @SerializedName("id")              public String id;
        @SerializedName("reasoning_ids")   public List<String> reasoningIds = new ArrayList<>();
        @SerializedName("strategy")        public DecisionStrategy strategy;
        @SerializedName("options")         public List<JsonObject> options = new ArrayList<>();
        @SerializedName("selected_option") public JsonObject selectedOption;
        @SerializedName("criteria")        public Map<String, Double> criteria = new LinkedHashMap<>();
        @SerializedName("confidence")      public double confidence = 1.0;
        @SerializedName("timestamp")       public OffsetDateTime timestamp;
        @SerializedName("justification")   public String justification;

        @Override
        public void validate() {
            require("id", id);
            require("strategy", strategy);
            require("selected_option", selectedOption);
            require("timestamp", timestamp);
        }
    }

    public static class Goal extends OpenEntity {
        @SerializedName("id")               public String id;
        @SerializedName("name")             public String name;
        @SerializedName("description")      public String description;
        @SerializedName("priority")         public int priority;
        @SerializedName("parent_goal_id")   public String parentGoalId;
        @SerializedName("sub_goal_ids")     public List<String> subGoalIds = new ArrayList<>();
        @SerializedName("constraints")      public Map<String, JsonElement> constraints = new LinkedHashMap<>();
        @SerializedName("success_criteria") public Map<String, JsonElement> successCriteria = new LinkedHashMap<>();
        @SerializedName("status")           public String status = "active";
        @SerializedName("progress")         public double progress;

        @Override
        public void validate() {
            require("id", id);
            require("name", name);
            require("description", description);
        }
    }

    public static class Plan extends OpenEntity {
        @SerializedName("id")                 public String id;
        @SerializedName("goal_ids")           public List<String> goalIds = new ArrayList<>();
        @SerializedName("steps")              public List<JsonObject> steps = new ArrayList<>();
        @SerializedName("dependencies")       public Map<String, List<String>> dependencies = new LinkedHashMap<>();
        @SerializedName("resources_required") public Map<String, JsonElement> resourcesRequired = new LinkedHashMap<>();
        @SerializedName("estimated_duration") public Double estimatedDuration;
        @SerializedName("confidence")         public double confidence = 1.0;
        @SerializedName("alternatives")       public List<String> alternatives = new ArrayList<>();

        @Override
        public void validate() {
            require("id", id);
        }
    }

    public static class KnowledgeItem extends OpenEntity {
        @SerializedName("id")            public String id;
        @SerializedName("type")          public KnowledgeType type;
        @SerializedName("content")       public JsonElement content;
        @SerializedName("source")        public String source;
        @SerializedName("confidence")    public double confidence = 1.0;
        @SerializedName("created_at")    public OffsetDateTime createdAt;
        @SerializedName("last_accessed") public OffsetDateTime lastAccessed;
        @SerializedName("access_count")  public int accessCount;
        @SerializedName("tags")          public List<String> tags = new ArrayList<>();

        @Override
        public void validate() {
            require("id", id);
            require("type", type);
            require("source", source);
            require("created_at", createdAt);
            require("last_accessed", lastAccessed);
        }
    }

    public static class Memory extends OpenEntity {
        @SerializedName("id")           public String id;
        @SerializedName("type")         public String type;
        @SerializedName("content")      public JsonElement content;
        @SerializedName("importance")   public double importance = 0.5;
        @SerializedName("timestamp")    public OffsetDateTime timestamp;
        @SerializedName("decay_rate")   public double decayRate;
        @SerializedName("associations") public List<String> associations = new ArrayList<>();  // memory ids

        @Override
        public void validate() {
            require("id", id);
            require("type", type);
            require("timestamp", timestamp);
        }
    }

    public static class LearningEvent extends OpenEntity {
        @SerializedName("id")                public String id;
        @SerializedName("type")              public LearningType type;
        @SerializedName("trigger")           public String trigger;
        @SerializedName("input_data")        public JsonElement inputData;
        @SerializedName("learned_content")   public JsonElement learnedContent;
        @SerializedName("knowledge_updates") public List<String> knowledgeUpdates = new ArrayList<>();
        @SerializedName("performance_delta") public Double performanceDelta;
        @SerializedName("timestamp")         public OffsetDateTime timestamp;

        @Override
        public void validate() {
            require("id", id);
            require("type", type);
            require("trigger", trigger);
            require("timestamp", timestamp);
        }
    }

    public static class CognitionSnapshot extends OpenEntity {
        @SerializedName("timestamp")         public OffsetDateTime timestamp;
        @SerializedName("active_reasoning")  public List<Reasoning> activeReasoning = new ArrayList<>();
        @SerializedName("recent_decisions")  public List<Decision> recentDecisions = new ArrayList<>();
        @SerializedName("current_goals")     public List<Goal> currentGoals = new ArrayList<>();
        @SerializedName("active_plans")      public List<Plan> activePlans = new ArrayList<>();
        @SerializedName("knowledge_stats")   public Map<String, Integer> knowledgeStats = new LinkedHashMap<>();
        @SerializedName("learning_rate")     public double learningRate;
        @SerializedName("uncertainty_level") public double uncertaintyLevel;

        @Override
        public void validate() {
            require("timestamp", timestamp);
        }
    }
}
