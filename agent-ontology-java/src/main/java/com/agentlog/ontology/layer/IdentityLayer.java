package com.agentlog.ontology.layer;

import com.agentlog.ontology.schema.OntologyEnum;
import com.agentlog.ontology.schema.OpenEntity;
import com.agentlog.ontology.schema.ValidationException;
import com.google.gson.JsonElement;
import com.google.gson.annotations.SerializedName;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Identity layer: who the agent is, what it can do, and how it is configured.
 */
public final class IdentityLayer {

    private IdentityLayer() {}

    public enum AgentType implements OntologyEnum {
        CONVERSATIONAL("conversational"),
        TASK_EXECUTION("task-execution"),
        REASONING("reasoning"),
        LEARNING("learning"),
        HYBRID("hybrid"),
        GENERAL("general"),
        DELIBERATIVE("deliberative"),
        REACTIVE("reactive");

        private final String tag;
        AgentType(String tag) { this.tag = tag; }
        @Override public String tag() { return tag; }
    }

    public enum AgentDomain implements OntologyEnum {
        CUSTOMER_SUPPORT("customer-support"),
        FINANCE("finance"),
        SOFTWARE_DEVELOPMENT("software-development"),
        HEALTHCARE("healthcare"),
        EDUCATION("education"),
        GENERAL("general");

        private final String tag;
        AgentDomain(String tag) { this.tag = tag; }
        @Override public String tag() { return tag; }
    }

    public static class AgentCapability extends OpenEntity {
        @SerializedName("name")        public String name;
        @SerializedName("version")     public String version = "1.0.0";
        @SerializedName("parameters")  public Map<String, JsonElement> parameters = new LinkedHashMap<>();
        @SerializedName("constraints") public Map<String, JsonElement> constraints = new LinkedHashMap<>();
        @SerializedName("enabled")     public boolean enabled = true;

        @Override
        public void validate() {
            require("name", name);
            require("version", version);
        }
    }

    public static class AgentConfiguration extends OpenEntity {
        @SerializedName("model_id")          public String modelId;
        @SerializedName("model_version")     public String modelVersion;
        @SerializedName("parameters")        public Map<String, JsonElement> parameters = new LinkedHashMap<>();
        @SerializedName("resource_limits")   public Map<String, JsonElement> resourceLimits = new LinkedHashMap<>();
        @SerializedName("security_settings") public Map<String, JsonElement> securitySettings = new LinkedHashMap<>();
        @SerializedName("feature_flags")     public Map<String, Boolean> featureFlags = new LinkedHashMap<>();
    }

    public static class AgentMetadata extends OpenEntity {
        @SerializedName("created_at")        public OffsetDateTime createdAt;
        @SerializedName("created_by")        public String createdBy;
        @SerializedName("version")           public String version;
        @SerializedName("description")       public String description;
        @SerializedName("tags")              public List<String> tags = new ArrayList<>();
        @SerializedName("documentation_url") public String documentationUrl;
        @SerializedName("license")           public String license;
        @SerializedName("custom_metadata")   public Map<String, JsonElement> customMetadata = new LinkedHashMap<>();

        @Override
        public void validate() {
            require("created_at", createdAt);
            require("created_by", createdBy);
            require("version", version);
        }
    }

    /**
     * One agent. Hierarchies are expressed through {@code parentAgentId} and
     * {@code childAgentIds}; cycles are not detected.
     */
    public static class AgentInstance extends OpenEntity {
        @SerializedName("id")              public String id;
        @SerializedName("name")            public String name;
        @SerializedName("types")           public List<AgentType> types = new ArrayList<>();
        @SerializedName("domains")         public List<AgentDomain> domains = new ArrayList<>();
        @SerializedName("capabilities")    public List<AgentCapability> capabilities = new ArrayList<>();
        @SerializedName("configuration")   public AgentConfiguration configuration;
        @SerializedName("metadata")        public AgentMetadata metadata;
        @SerializedName("parent_agent_id") public String parentAgentId;
        @SerializedName("child_agent_ids") public List<String> childAgentIds = new ArrayList<>();

        @Override
        public void validate() {
            require("id", id);
            require("name", name);
            requireNonEmpty("types", types);
            requireNoNulls("types", types);
            requireNoNulls("domains", domains);
            require("configuration", configuration);
            require("metadata", metadata);

            Set<String> seen = new HashSet<>();
            for (AgentCapability capability : capabilities) {
                if (capability != null && !seen.add(capability.name)) {
                    throw ValidationException.invalid("AgentInstance", "capabilities",
                            "has duplicate capability name '" + capability.name + "'");
                }
            }
        }
    }
}
