package com.agentlog.connector;

import com.agentlog.ontology.layer.ActionLayer;
import com.agentlog.ontology.layer.IdentityLayer;
import com.agentlog.ontology.layer.InteractionLayer;
import com.agentlog.ontology.layer.PerceptionLayer;
import com.agentlog.ontology.layer.StateLayer;
import com.agentlog.ontology.run.Run;
import com.agentlog.ontology.run.RunStatus;
import com.agentlog.ontology.run.Step;
import com.agentlog.ontology.schema.MalformedTimestampException;
import com.agentlog.ontology.schema.Timestamps;
import com.agentlog.ontology.schema.ValidationException;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts one OpenAI-style agent trace into a {@link Run}.
 *
 * The trace is irregular: every field may be missing. Missing ids are derived
 * from the step index, missing timestamps fall back to the clock (read once per
 * conversion), and missing literals come from {@link ConnectorConfig}. A
 * malformed timestamp is the one hard failure; it names the offending field.
 */
public class OpenAiTraceConnector {

    private static final String USER_ID = "user";
    private static final String CONFIGURATION_HASH_INITIAL = "initial";
    private static final String CONFIGURATION_HASH_ACTIVE = "active";

    private final ConnectorConfig config;
    private final Clock clock;

    public OpenAiTraceConnector() {
        this(ConnectorConfig.defaults(), Clock.systemUTC());
    }

    public OpenAiTraceConnector(ConnectorConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * @param document parsed trace; {@code steps} may be absent
     * @return a fresh run owning all converted steps
     * @throws MalformedTimestampException if any timestamp is not ISO-8601
     * @throws ValidationException         if a field has an unusable JSON type
     */
    public Run convert(JsonObject document) {
        OpenAiTrace trace = OpenAiTrace.from(document);
        OffsetDateTime now = OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);

        OffsetDateTime startedAt = Timestamps.parse(trace.startedAt, "$.started_at");
        OffsetDateTime endedAt = Timestamps.parse(trace.endedAt, "$.ended_at");
        OffsetDateTime runStart = startedAt != null ? startedAt : now;

        IdentityLayer.AgentInstance agent = buildAgent(trace, runStart);

        Run run = new Run();
        run.id = trace.id != null ? trace.id : "unknown";
        run.name = "OpenAI Agent Run " + run.id;
        run.agent = agent;
        run.startTime = runStart;
        run.endTime = endedAt;
        if (startedAt != null && endedAt != null) {
            run.duration = Timestamps.secondsBetween(startedAt, endedAt);
        }
        run.status = mapStatus(trace.status);
        run.initialState = buildInitialState(agent.id, runStart);

        Set<String> seenStepIds = new HashSet<>();
        List<OpenAiTrace.Step> steps = trace.getSteps();
        for (int i = 0; i < steps.size(); i++) {
            Step step = convertStep(steps.get(i), i, agent.id, now);
            if (!seenStepIds.add(step.id)) {
                System.err.println("[trace-connector] WARNING: duplicate step id in trace " + run.id + ": " + step.id);
            }
            run.addStep(step);
        }

        // counted over the raw trace, not the converted steps
        for (OpenAiTrace.Step s : steps) {
            if (s.isMessage()) run.totalMessages++;
            if (s.isTool()) run.totalActions++;
            if (s.isMessage() || s.isTool()) run.totalObservations++;
        }

        if (!run.steps.isEmpty()) {
            run.finalState = run.steps.get(run.steps.size() - 1).completeState;
        }
        return run;
    }

    static RunStatus mapStatus(String status) {
        if (status == null) return RunStatus.UNKNOWN;
        return switch (status) {
            case "completed" -> RunStatus.COMPLETED;
            case "failed"    -> RunStatus.FAILED;
            case "cancelled" -> RunStatus.CANCELLED;
            case "running"   -> RunStatus.RUNNING;
            default          -> RunStatus.UNKNOWN;
        };
    }

    // --- agent ---

    private IdentityLayer.AgentInstance buildAgent(OpenAiTrace trace, OffsetDateTime createdAt) {
        String agentId = trace.agentId != null ? trace.agentId
                : trace.id != null ? trace.id
                : "unknown";

        IdentityLayer.AgentInstance agent = new IdentityLayer.AgentInstance();
        agent.id = agentId;
        agent.name = "OpenAI Agent " + agentId;
        agent.types.add(IdentityLayer.AgentType.CONVERSATIONAL);
        if (trace.getSteps().stream().anyMatch(OpenAiTrace.Step::isTool)) {
            agent.types.add(IdentityLayer.AgentType.TASK_EXECUTION);
        }
        agent.domains.add(IdentityLayer.AgentDomain.GENERAL);

        Set<String> toolNames = new LinkedHashSet<>();
        for (OpenAiTrace.Step s : trace.getSteps()) {
            if (s.isTool() && s.toolName != null && !s.toolName.isBlank()) {
                toolNames.add(s.toolName);
            }
        }
        for (String toolName : toolNames) {
            IdentityLayer.AgentCapability capability = new IdentityLayer.AgentCapability();
            capability.name = TraceIds.capability(toolName);
            capability.version = config.getCapabilityVersion();
            capability.enabled = true;
            agent.capabilities.add(capability);
        }

        IdentityLayer.AgentConfiguration configuration = new IdentityLayer.AgentConfiguration();
        configuration.modelId = trace.model != null ? trace.model : config.getDefaultModelId();
        if (trace.config != null && trace.config.isJsonObject()) {
            configuration.parameters = copyEntries(trace.config.getAsJsonObject());
        }
        agent.configuration = configuration;

        IdentityLayer.AgentMetadata metadata = new IdentityLayer.AgentMetadata();
        metadata.createdAt = createdAt;
        metadata.createdBy = config.getCreatedBy();
        metadata.version = "1.0.0";
        metadata.tags.add("openai");
        metadata.tags.add("trace-import");
        agent.metadata = metadata;
        return agent;
    }

    // --- steps ---

    private Step convertStep(OpenAiTrace.Step source, int index, String agentId, OffsetDateTime now) {
        String stepId = TraceIds.step(source.id, index);
        OffsetDateTime parsed = Timestamps.parse(source.timestamp, "$.steps[" + index + "].timestamp");
        OffsetDateTime timestamp = parsed != null ? parsed : now;

        Step step = new Step();
        step.id = stepId;
        step.name = source.type != null ? source.type : "unknown";
        step.stepNumber = index;
        step.startTime = timestamp;
        step.inputs.put("original_step", source.raw.deepCopy());

        if (source.isMessage()) {
            step.perceptionState = messagePerception(source, stepId, agentId, timestamp);
            step.interactionState = messageInteraction(source, stepId, agentId, timestamp);
            step.outputs.put("message_content", contentOrEmpty(source));
        } else if (source.isTool()) {
            step.actionState = toolAction(source, stepId, index, agentId, timestamp);
            step.outputs.put("tool_output", present(source.output) ? source.output.deepCopy() : JsonNull.INSTANCE);
        } else {
            System.err.println("[trace-connector] WARNING: step " + index + " has unrecognized type '"
                    + source.type + "', converted without layer snapshots");
        }

        step.completeState = stepState(source, stepId, agentId, timestamp);
        return step;
    }

    private PerceptionLayer.PerceptionSnapshot messagePerception(
            OpenAiTrace.Step source, String stepId, String agentId, OffsetDateTime timestamp) {
        PerceptionLayer.Observation observation = new PerceptionLayer.Observation();
        observation.id = TraceIds.observation(stepId);
        observation.processorId = TraceIds.nlpProcessor(agentId);
        observation.signalIds.add(TraceIds.signal(stepId));
        observation.type = "text-message";
        observation.content = contentOrEmpty(source);
        observation.confidence = 1.0;
        observation.timestamp = timestamp;
        observation.metadata.put("role", new JsonPrimitive(roleOf(source)));

        PerceptionLayer.PerceptionSnapshot snapshot = new PerceptionLayer.PerceptionSnapshot();
        snapshot.timestamp = timestamp;
        snapshot.currentObservations.add(observation);
        snapshot.processingQueueSize = 0;
        return snapshot;
    }

    private InteractionLayer.InteractionSnapshot messageInteraction(
            OpenAiTrace.Step source, String stepId, String agentId, OffsetDateTime timestamp) {
        boolean fromAgent = "assistant".equals(source.role);

        InteractionLayer.Message message = new InteractionLayer.Message();
        message.id = stepId;
        message.type = fromAgent ? InteractionLayer.MessageType.RESPONSE : InteractionLayer.MessageType.REQUEST;
        message.senderId = fromAgent ? agentId : USER_ID;
        message.recipientId = fromAgent ? USER_ID : agentId;
        message.interfaceId = config.getInterfaceId();
        message.content = contentOrEmpty(source);
        message.timestamp = timestamp;

        InteractionLayer.InteractionSnapshot snapshot = new InteractionLayer.InteractionSnapshot();
        snapshot.timestamp = timestamp;
        snapshot.recentMessages.add(message);
        snapshot.pendingMessages = 0;
        return snapshot;
    }

    private ActionLayer.ActionSnapshot toolAction(
            OpenAiTrace.Step source, String stepId, int index, String agentId, OffsetDateTime timestamp) {
        Map<String, JsonElement> input = toolInput(source, index);
        JsonElement output = present(source.output) ? source.output : null;

        // the trace records a single instant per tool call
        ActionLayer.ToolInvocation invocation = new ActionLayer.ToolInvocation();
        invocation.id = TraceIds.toolInvocation(stepId);
        invocation.toolName = source.toolName != null ? source.toolName : "";
        invocation.actionExecutionId = stepId;
        invocation.inputParameters = input;
        invocation.outputData = output != null ? output.deepCopy() : null;
        invocation.startTime = timestamp;
        invocation.endTime = timestamp;

        ActionLayer.ActionExecution execution = new ActionLayer.ActionExecution();
        execution.id = stepId;
        execution.actionPlanId = TraceIds.actionPlan(stepId);
        execution.status = ActionLayer.ActionStatus.COMPLETED;
        execution.startTime = timestamp;
        execution.endTime = timestamp;
        execution.executorId = agentId;
        execution.actualParameters = toolInput(source, index);
        execution.results = output != null ? output.deepCopy() : null;
        execution.toolInvocations.add(invocation);

        ActionLayer.ActionSnapshot snapshot = new ActionLayer.ActionSnapshot();
        snapshot.timestamp = timestamp;
        snapshot.completedActions.add(execution);
        snapshot.actionQueueSize = 0;
        return snapshot;
    }

    private StateLayer.CompleteState stepState(
            OpenAiTrace.Step source, String stepId, String agentId, OffsetDateTime timestamp) {
        StateLayer.CompleteState state = new StateLayer.CompleteState();
        state.timestamp = timestamp;
        state.agentState = agentState(agentId, stepId, StateLayer.AgentStatus.ACTIVE,
                CONFIGURATION_HASH_ACTIVE, timestamp);

        state.executionState = executionState(agentId, stepId,
                source.isTool() ? StateLayer.ExecutionPhase.EXECUTION : StateLayer.ExecutionPhase.PERCEPTION);
        state.executionState.activeTasks.add(stepId);

        state.cognitiveState = cognitiveState(agentId, stepId);
        state.cognitiveState.attentionFocus.add(source.type != null ? source.type : "");

        state.perceptualState = perceptualState(agentId, stepId);
        state.perceptualState.activeSensors.add(config.getInterfaceId());
        JsonElement lastInput = isTruthy(source.content) ? source.content
                : present(source.input) ? source.input
                : JsonNull.INSTANCE;
        state.perceptualState.sensorReadings.put("last_input", lastInput.deepCopy());
        return state;
    }

    private StateLayer.CompleteState buildInitialState(String agentId, OffsetDateTime timestamp) {
        StateLayer.CompleteState state = new StateLayer.CompleteState();
        state.timestamp = timestamp;
        state.agentState = agentState(agentId, TraceIds.INITIAL, StateLayer.AgentStatus.INITIALIZING,
                CONFIGURATION_HASH_INITIAL, timestamp);
        state.executionState = executionState(agentId, TraceIds.INITIAL, StateLayer.ExecutionPhase.IDLE);
        state.cognitiveState = cognitiveState(agentId, TraceIds.INITIAL);
        state.perceptualState = perceptualState(agentId, TraceIds.INITIAL);
        return state;
    }

    private static StateLayer.AgentState agentState(String agentId, String suffix, StateLayer.AgentStatus status,
                                                    String configurationHash, OffsetDateTime lastActivity) {
        StateLayer.AgentState s = new StateLayer.AgentState();
        s.id = TraceIds.agentState(agentId, suffix);
        s.agentId = agentId;
        s.status = status;
        s.healthScore = 1.0;
        s.uptime = 0.0;
        s.lastActivity = lastActivity;
        s.configurationHash = configurationHash;
        return s;
    }

    private static StateLayer.ExecutionState executionState(String agentId, String suffix,
                                                            StateLayer.ExecutionPhase phase) {
        StateLayer.ExecutionState s = new StateLayer.ExecutionState();
        s.id = TraceIds.executionState(agentId, suffix);
        s.phase = phase;
        return s;
    }

    private static StateLayer.CognitiveState cognitiveState(String agentId, String suffix) {
        StateLayer.CognitiveState s = new StateLayer.CognitiveState();
        s.id = TraceIds.cognitiveState(agentId, suffix);
        return s;
    }

    private static StateLayer.PerceptualState perceptualState(String agentId, String suffix) {
        StateLayer.PerceptualState s = new StateLayer.PerceptualState();
        s.id = TraceIds.perceptualState(agentId, suffix);
        return s;
    }

    // --- field helpers ---

    /** Role for observation metadata only; message direction looks at the raw role. */
    private String roleOf(OpenAiTrace.Step source) {
        return source.role != null ? source.role : config.getDefaultRole();
    }

    private static JsonElement contentOrEmpty(OpenAiTrace.Step source) {
        return present(source.content) ? source.content.deepCopy() : new JsonPrimitive("");
    }

    private static Map<String, JsonElement> toolInput(OpenAiTrace.Step source, int index) {
        if (!present(source.input)) {
            return new LinkedHashMap<>();
        }
        if (!source.input.isJsonObject()) {
            throw ValidationException.typeMismatch("ToolInvocation", "$.steps[" + index + "].input",
                    "tool input must be a JSON object", null);
        }
        return copyEntries(source.input.getAsJsonObject());
    }

    private static Map<String, JsonElement> copyEntries(JsonObject object) {
        Map<String, JsonElement> copy = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> e : object.entrySet()) {
            copy.put(e.getKey(), e.getValue().deepCopy());
        }
        return copy;
    }

    private static boolean present(JsonElement value) {
        return value != null && !value.isJsonNull();
    }

    /** Truthiness as the trace producers use it: empty strings, zero, false and empty containers are falsy. */
    static boolean isTruthy(JsonElement value) {
        if (!present(value)) return false;
        if (value.isJsonArray()) return value.getAsJsonArray().size() > 0;
        if (value.isJsonObject()) return value.getAsJsonObject().size() > 0;
        JsonPrimitive p = value.getAsJsonPrimitive();
        if (p.isBoolean()) return p.getAsBoolean();
        if (p.isNumber()) return p.getAsDouble() != 0.0;
        return !p.getAsString().isEmpty();
    }
}
