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
 * Interaction layer: interfaces, conversations and the messages exchanged over them.
 */
public final class InteractionLayer {

    private InteractionLayer() {}

    public enum InterfaceType implements OntologyEnum {
        HUMAN("human"),
        AGENT("agent"),
        SYSTEM("system"),
        ENVIRONMENT("environment");

        private final String tag;
        InterfaceType(String tag) { this.tag = tag; }
        @Override public String tag() { return tag; }
    }

    public enum CommunicationProtocol implements OntologyEnum {
        HTTP("http"),
        WEBSOCKET("websocket"),
        GRPC("grpc"),
        MESSAGE_QUEUE("message-queue"),
        SHARED_MEMORY("shared-memory"),
        CUSTOM("custom");

        private final String tag;
        CommunicationProtocol(String tag) { this.tag = tag; }
        @Override public String tag() { return tag; }
    }

    public enum MessageType implements OntologyEnum {
        REQUEST("request"),
        RESPONSE("response"),
        NOTIFICATION("notification"),
        COMMAND("command"),
        QUERY("query"),
        UPDATE("update"),
        ERROR("error"),
        ACKNOWLEDGMENT("acknowledgment");

        private final String tag;
        MessageType(String tag) { this.tag = tag; }
        @Override public String tag() { return tag; }
    }

    public static class Interface extends OpenEntity {
        @SerializedName("id")                      public String id;
        @SerializedName("name")                    public String name;
        @SerializedName("type")                    public InterfaceType type;
        @SerializedName("protocol")                public CommunicationProtocol protocol;
        @SerializedName("endpoint")                public String endpoint;
        @SerializedName("capabilities")            public List<String> capabilities = new ArrayList<>();
        @SerializedName("authentication_required") public boolean authenticationRequired;
        @SerializedName("rate_limits")             public Map<String, Integer> rateLimits = new LinkedHashMap<>();
        @SerializedName("active")                  public boolean active = true;

        @Override
        public void validate() {
            require("id", id);
            require("name", name);
            require("type", type);
            require("protocol", protocol);
            require("endpoint", endpoint);
        }
    }

    public static class Message extends OpenEntity {
        @SerializedName("id")             public String id;
        @SerializedName("type")           public MessageType type;
        @SerializedName("sender_id")      public String senderId;
        @SerializedName("recipient_id")   public String recipientId;
        @SerializedName("interface_id")   public String interfaceId;
        @SerializedName("content")        public JsonElement content;
        @SerializedName("metadata")       public Map<String, JsonElement> metadata = new LinkedHashMap<>();
        @SerializedName("timestamp")      public OffsetDateTime timestamp;
        @SerializedName("correlation_id") public String correlationId;
        @SerializedName("reply_to")       public String replyTo;
        @SerializedName("expires_at")     public OffsetDateTime expiresAt;

        @Override
        public void validate() {
            require("id", id);
            require("type", type);
            require("sender_id", senderId);
            require("recipient_id", recipientId);
            require("interface_id", interfaceId);
            require("timestamp", timestamp);
        }
    }

    public static class Conversation extends OpenEntity {
        @SerializedName("id")              public String id;
        @SerializedName("participant_ids") public List<String> participantIds = new ArrayList<>();
        @SerializedName("interface_ids")   public List<String> interfaceIds = new ArrayList<>();
        @SerializedName("start_time")      public OffsetDateTime startTime;
        @SerializedName("end_time")        public OffsetDateTime endTime;
        @SerializedName("message_count")   public int messageCount;
        @SerializedName("context")         public Map<String, JsonElement> context = new LinkedHashMap<>();
        @SerializedName("status")          public String status = "active";
        @SerializedName("topic")           public String topic;

        @Override
        public void validate() {
            require("id", id);
            require("start_time", startTime);
        }
    }

    public static class InteractionEvent extends OpenEntity {
        @SerializedName("id")              public String id;
        @SerializedName("event_type")      public String eventType;
        @SerializedName("timestamp")       public OffsetDateTime timestamp;
        @SerializedName("interface_id")    public String interfaceId;
        @SerializedName("participant_ids") public List<String> participantIds = new ArrayList<>();
        @SerializedName("description")     public String description;
        @SerializedName("impact")          public String impact = "low";
        @SerializedName("data")            public Map<String, JsonElement> data = new LinkedHashMap<>();

        @Override
        public void validate() {
            require("id", id);
            require("event_type", eventType);
            require("timestamp", timestamp);
            require("interface_id", interfaceId);
            require("description", description);
        }
    }

    public static class ProtocolSpecification extends OpenEntity {
        @SerializedName("id")              public String id;
        @SerializedName("name")            public String name;
        @SerializedName("version")         public String version;
        @SerializedName("steps")           public List<JsonObject> steps = new ArrayList<>();
        @SerializedName("message_formats") public Map<String, JsonElement> messageFormats = new LinkedHashMap<>();
        @SerializedName("state_machine")   public Map<String, JsonElement> stateMachine = new LinkedHashMap<>();
        @SerializedName("timeouts")        public Map<String, Double> timeouts = new LinkedHashMap<>();
        @SerializedName("error_handling")  public Map<String, JsonElement> errorHandling = new LinkedHashMap<>();

        @Override
        public void validate() {
            require("id", id);
            require("name", name);
            require("version", version);
        }
    }

    public static class InteractionMetrics extends OpenEntity {
        @SerializedName("id")                   public String id;
        @SerializedName("interface_id")         public String interfaceId;
        @SerializedName("time_window")          public double timeWindow;  // seconds
        @SerializedName("message_count")        public int messageCount;
        @SerializedName("error_count")          public int errorCount;
        @SerializedName("average_latency")      public double averageLatency;  // ms
        @SerializedName("throughput")           public double throughput;
        @SerializedName("success_rate")         public double successRate = 1.0;
        @SerializedName("active_conversations") public int activeConversations;

        @Override
        public void validate() {
            require("id", id);
            require("interface_id", interfaceId);
        }
    }

    public static class InteractionPolicy extends OpenEntity {
        @SerializedName("id")              public String id;
        @SerializedName("name")            public String name;
        @SerializedName("interface_types") public List<InterfaceType> interfaceTypes = new ArrayList<>();
        @SerializedName("rules")           public List<JsonObject> rules = new ArrayList<>();
        @SerializedName("permissions")     public Map<String, List<String>> permissions = new LinkedHashMap<>();
        @SerializedName("restrictions")    public Map<String, List<String>> restrictions = new LinkedHashMap<>();
        @SerializedName("priority")        public int priority;
        @SerializedName("active")          public boolean active = true;

        @Override
        public void validate() {
            require("id", id);
            require("name", name);
            requireNoNulls("interface_types", interfaceTypes);
        }
    }

    public static class InteractionSnapshot extends OpenEntity {
        @SerializedName("timestamp")             public OffsetDateTime timestamp;
        @SerializedName("active_interfaces")     public List<Interface> activeInterfaces = new ArrayList<>();
        @SerializedName("ongoing_conversations") public List<Conversation> ongoingConversations = new ArrayList<>();
        @SerializedName("recent_messages")       public List<Message> recentMessages = new ArrayList<>();
        @SerializedName("interface_metrics")     public List<InteractionMetrics> interfaceMetrics = new ArrayList<>();
        @SerializedName("active_policies")       public List<InteractionPolicy> activePolicies = new ArrayList<>();
        @SerializedName("pending_messages")      public int pendingMessages;

        @Override
        public void validate() {
            require("timestamp", timestamp);
        }
    }
}
