package com.agentlog.connector;

import com.agentlog.ontology.layer.ActionLayer;
import com.agentlog.ontology.layer.IdentityLayer;
import com.agentlog.ontology.layer.InteractionLayer;
import com.agentlog.ontology.layer.PerceptionLayer;
import com.agentlog.ontology.layer.StateLayer;
import com.agentlog.ontology.run.Run;
import com.agentlog.ontology.run.RunStatus;
import com.agentlog.ontology.run.Step;
import com.agentlog.ontology.run.StepTree;
import com.agentlog.ontology.schema.MalformedTimestampException;
import com.agentlog.ontology.schema.ValidationException;
import com.agentlog.ontology.serial.OntologySerializer;
import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiTraceConnectorTest {

    private static final Instant FROZEN = Instant.parse("2030-06-15T08:00:00Z");

    private final OpenAiTraceConnector connector =
            new OpenAiTraceConnector(ConnectorConfig.defaults(), Clock.fixed(FROZEN, ZoneOffset.UTC));

    private static JsonObject json(String text) {
        return JsonParser.parseString(text).getAsJsonObject();
    }

    private static JsonObject sample() throws IOException {
        try (InputStream in = OpenAiTraceConnectorTest.class.getResourceAsStream("/samples/openai_example.json");
             Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return JsonParser.parseReader(reader).getAsJsonObject();
        }
    }

    @Test
    void userMessageBecomesRequestFromUser() {
        Run run = connector.convert(json("""
            {"id": "r1", "steps": [
              {"id": "s1", "type": "message", "role": "user", "content": "hi",
               "timestamp": "2024-01-01T00:00:00Z"}
            ]}
            """));

        assertEquals(1, run.steps.size());
        Step step = run.steps.get(0);
        InteractionLayer.Message message = step.interactionState.recentMessages.get(0);
        assertEquals(InteractionLayer.MessageType.REQUEST, message.type);
        assertEquals("user", message.senderId);
        assertEquals(run.agent.id, message.recipientId);
        assertEquals(new JsonPrimitive("hi"), message.content);
        assertEquals("openai-api", message.interfaceId);
        assertEquals("s1", message.id);

        PerceptionLayer.Observation observation = step.perceptionState.currentObservations.get(0);
        assertEquals("s1-obs", observation.id);
        assertEquals("r1-nlp-processor", observation.processorId);
        assertEquals(List.of("s1-signal"), observation.signalIds);
        assertEquals("text-message", observation.type);
        assertEquals(1.0, observation.confidence);
        assertEquals(new JsonPrimitive("user"), observation.metadata.get("role"));
        assertEquals(new JsonPrimitive("hi"), step.outputs.get("message_content"));
        assertNull(step.actionState);
    }

    @Test
    void messageWithoutRoleIsRequestFromUser() {
        Run run = connector.convert(json("""
            {"id": "r1", "agent_id": "bot", "steps": [{"id": "s1", "type": "message", "content": "hello"}]}
            """));

        InteractionLayer.Message message = run.steps.get(0).interactionState.recentMessages.get(0);
        assertEquals(InteractionLayer.MessageType.REQUEST, message.type);
        assertEquals("user", message.senderId);
        assertEquals("bot", message.recipientId);
        // the observation still records the default role
        assertEquals(new JsonPrimitive("assistant"),
                run.steps.get(0).perceptionState.currentObservations.get(0).metadata.get("role"));
    }

    @Test
    void assistantMessageIsResponseToUser() {
        Run run = connector.convert(json("""
            {"id": "r1", "agent_id": "bot", "steps": [{"id": "s1", "type": "message", "role": "assistant", "content": "ok"}]}
            """));

        InteractionLayer.Message message = run.steps.get(0).interactionState.recentMessages.get(0);
        assertEquals(InteractionLayer.MessageType.RESPONSE, message.type);
        assertEquals("bot", message.senderId);
        assertEquals("user", message.recipientId);
    }

    @Test
    void toolStepBecomesCompletedExecutionWithInvocation() {
        Run run = connector.convert(json("""
            {"id": "r1", "steps": [
              {"id": "s2", "type": "tool", "tool_name": "search", "input": {"q": "x"}, "output": {"r": 1},
               "timestamp": "2024-01-01T00:00:01Z"}
            ]}
            """));

        Step step = run.steps.get(0);
        assertEquals(1, step.actionState.completedActions.size());
        ActionLayer.ActionExecution execution = step.actionState.completedActions.get(0);
        assertEquals(ActionLayer.ActionStatus.COMPLETED, execution.status);
        assertEquals("s2", execution.id);
        assertEquals("s2-plan", execution.actionPlanId);
        assertEquals(run.agent.id, execution.executorId);
        assertEquals(json("{\"q\": \"x\"}").get("q"), execution.actualParameters.get("q"));
        assertEquals(json("{\"r\": 1}"), execution.results);

        ActionLayer.ToolInvocation invocation = execution.toolInvocations.get(0);
        assertEquals("s2-tool", invocation.id);
        assertEquals("search", invocation.toolName);
        assertEquals("s2", invocation.actionExecutionId);
        assertEquals(1, invocation.inputParameters.size());
        assertEquals(new JsonPrimitive("x"), invocation.inputParameters.get("q"));
        assertEquals(json("{\"r\": 1}"), invocation.outputData);
        OffsetDateTime at = OffsetDateTime.of(2024, 1, 1, 0, 0, 1, 0, ZoneOffset.UTC);
        assertEquals(at, invocation.startTime);
        assertEquals(at, invocation.endTime);

        assertEquals(json("{\"r\": 1}"), step.outputs.get("tool_output"));
        assertNull(step.interactionState);
        assertNull(step.perceptionState);
    }

    @Test
    void aggregateCountsComeFromRawSteps() {
        Run run = connector.convert(json("""
            {"id": "r1", "steps": [
              {"type": "message", "content": "a"},
              {"type": "tool", "tool_name": "t"},
              {"type": "message", "content": "b"},
              {"type": "reflection"}
            ]}
            """));

        assertEquals(2, run.totalMessages);
        assertEquals(1, run.totalActions);
        assertEquals(3, run.totalObservations);
        assertEquals(0, run.totalDecisions);
    }

    @Test
    void statusOutsideTableMapsToUnknown() {
        assertEquals(RunStatus.UNKNOWN, connector.convert(json("{\"id\": \"r\", \"status\": \"paused\"}")).status);
        assertEquals(RunStatus.UNKNOWN, connector.convert(json("{\"id\": \"r\"}")).status);
        assertEquals(RunStatus.FAILED, connector.convert(json("{\"id\": \"r\", \"status\": \"failed\"}")).status);
        assertEquals(RunStatus.RUNNING, OpenAiTraceConnector.mapStatus("running"));
        assertEquals(RunStatus.CANCELLED, OpenAiTraceConnector.mapStatus("cancelled"));
        assertEquals(RunStatus.COMPLETED, OpenAiTraceConnector.mapStatus("completed"));
    }

    @Test
    void conversionIsDeterministicUnderFrozenClock() throws IOException {
        JsonObject trace = sample();
        trace.getAsJsonArray("steps").get(0).getAsJsonObject().remove("timestamp");
        trace.remove("started_at");

        Run first = connector.convert(trace);
        Run second = connector.convert(trace);

        assertEquals(first, second);
        assertNotSame(first, second);
    }

    @Test
    void missingTimestampsFallBackToClock() {
        Run run = connector.convert(json("{\"id\": \"r\", \"steps\": [{\"type\": \"message\"}]}"));
        OffsetDateTime now = OffsetDateTime.ofInstant(FROZEN, ZoneOffset.UTC);

        assertEquals(now, run.startTime);
        assertEquals(now, run.steps.get(0).startTime);
        assertEquals(now, run.agent.metadata.createdAt);
        assertNull(run.endTime);
        assertNull(run.duration);
    }

    @Test
    void missingIdentifiersAreSynthesized() {
        Run run = connector.convert(json("""
            {"steps": [{"type": "message"}, {"type": "tool", "tool_name": "t"}]}
            """));

        assertEquals("unknown", run.agent.id);
        assertEquals("OpenAI Agent unknown", run.agent.name);
        assertEquals("step-0", run.steps.get(0).id);
        assertEquals("step-1", run.steps.get(1).id);
        assertEquals(1, run.steps.get(1).stepNumber);
        assertEquals("step-1-tool",
                run.steps.get(1).actionState.completedActions.get(0).toolInvocations.get(0).id);
        assertEquals("unknown-state-step-0", run.steps.get(0).completeState.agentState.id);
    }

    @Test
    void agentIdPrefersAgentIdOverTraceId() {
        assertEquals("a", connector.convert(json("{\"id\": \"r\", \"agent_id\": \"a\"}")).agent.id);
        assertEquals("r", connector.convert(json("{\"id\": \"r\"}")).agent.id);
    }

    @Test
    void agentIsInferredFromToolUse() throws IOException {
        Run run = connector.convert(sample());
        IdentityLayer.AgentInstance agent = run.agent;

        assertEquals(List.of(IdentityLayer.AgentType.CONVERSATIONAL, IdentityLayer.AgentType.TASK_EXECUTION),
                agent.types);
        assertEquals(List.of(IdentityLayer.AgentDomain.GENERAL), agent.domains);
        assertEquals(1, agent.capabilities.size());
        assertEquals("tool:get_weather", agent.capabilities.get(0).name);
        assertEquals("1.0.0", agent.capabilities.get(0).version);
        assertTrue(agent.capabilities.get(0).enabled);
        assertEquals("gpt-4o", agent.configuration.modelId);
        assertEquals(new JsonPrimitive(512), agent.configuration.parameters.get("max_tokens"));
        assertEquals("openai", agent.metadata.createdBy);
        assertEquals(List.of("openai", "trace-import"), agent.metadata.tags);
    }

    @Test
    void messageOnlyTraceIsConversationalWithDefaultModel() {
        Run run = connector.convert(json("{\"id\": \"r\", \"steps\": [{\"type\": \"message\", \"content\": \"x\"}]}"));

        assertEquals(List.of(IdentityLayer.AgentType.CONVERSATIONAL), run.agent.types);
        assertTrue(run.agent.capabilities.isEmpty());
        assertEquals("gpt-4", run.agent.configuration.modelId);
        assertTrue(run.agent.configuration.parameters.isEmpty());
    }

    @Test
    void capabilitiesKeepFirstSeenOrderAndSkipBlankNames() {
        Run run = connector.convert(json("""
            {"id": "r", "steps": [
              {"type": "tool", "tool_name": "b"},
              {"type": "tool", "tool_name": ""},
              {"type": "tool", "tool_name": "a"},
              {"type": "tool", "tool_name": "b"},
              {"type": "tool"}
            ]}
            """));

        assertEquals(List.of("tool:b", "tool:a"), run.agent.capabilities.stream().map(c -> c.name).toList());
    }

    @Test
    void sampleTraceConvertsEndToEnd() throws IOException {
        Run run = connector.convert(sample());

        assertEquals("run_abc123", run.id);
        assertEquals("OpenAI Agent Run run_abc123", run.name);
        assertEquals(RunStatus.COMPLETED, run.status);
        assertEquals(4, run.steps.size());
        assertEquals(7.5, run.duration, 1e-9);
        assertEquals(1, StepTree.maxNestingDepth(run));
        assertEquals(2, run.totalMessages);
        assertEquals(2, run.totalActions);
        assertEquals(4, run.totalObservations);

        Step nullOutput = run.steps.get(2);
        assertNull(nullOutput.actionState.completedActions.get(0).results);
        assertTrue(nullOutput.outputs.get("tool_output").isJsonNull());
    }

    @Test
    void everyStepCarriesCompleteState() throws IOException {
        Run run = connector.convert(sample());

        StateLayer.CompleteState tool = run.steps.get(1).completeState;
        assertEquals(StateLayer.ExecutionPhase.EXECUTION, tool.executionState.phase);
        assertEquals(StateLayer.AgentStatus.ACTIVE, tool.agentState.status);
        assertEquals(1.0, tool.agentState.healthScore);
        assertEquals(List.of("tool"), tool.cognitiveState.attentionFocus);
        assertEquals(List.of("step_2"), tool.executionState.activeTasks);
        assertEquals(List.of("openai-api"), tool.perceptualState.activeSensors);
        assertEquals(json("{\"city\": \"Paris\", \"units\": \"metric\"}"),
                tool.perceptualState.sensorReadings.get("last_input"));

        StateLayer.CompleteState message = run.steps.get(0).completeState;
        assertEquals(StateLayer.ExecutionPhase.PERCEPTION, message.executionState.phase);
        assertEquals(new JsonPrimitive("What is the weather in Paris?"),
                message.perceptualState.sensorReadings.get("last_input"));
        assertEquals("asst_support_01-state-step_1", message.agentState.id);
    }

    @Test
    void emptyContentFallsBackToInputForLastInput() {
        Run run = connector.convert(json("""
            {"id": "r", "steps": [{"type": "tool", "content": "", "input": {"k": 1}}, {"type": "message"}]}
            """));

        assertEquals(json("{\"k\": 1}"), run.steps.get(0).completeState.perceptualState.sensorReadings.get("last_input"));
        assertTrue(run.steps.get(1).completeState.perceptualState.sensorReadings.get("last_input").isJsonNull());
        assertEquals(new JsonPrimitive(""), run.steps.get(1).outputs.get("message_content"));
    }

    @Test
    void finalStateIsLastStepStateAndInitialStateIsIdle() throws IOException {
        Run run = connector.convert(sample());

        assertSame(run.steps.get(3).completeState, run.finalState);
        assertEquals(StateLayer.AgentStatus.INITIALIZING, run.initialState.agentState.status);
        assertEquals(StateLayer.ExecutionPhase.IDLE, run.initialState.executionState.phase);
        assertEquals("asst_support_01-exec-initial", run.initialState.executionState.id);
        assertEquals(run.startTime, run.initialState.timestamp);
    }

    @Test
    void traceWithoutStepsHasNoFinalState() {
        Run run = connector.convert(json("{\"id\": \"r\"}"));
        assertTrue(run.steps.isEmpty());
        assertNull(run.finalState);
        assertNotNull(run.initialState);
    }

    @Test
    void originalStepIsKeptVerbatim() throws IOException {
        JsonObject trace = sample();
        Run run = connector.convert(trace);
        assertEquals(trace.getAsJsonArray("steps").get(1), run.steps.get(1).inputs.get("original_step"));
    }

    @Test
    void unrecognizedStepTypeStillGetsCompleteState() {
        Run run = connector.convert(json("{\"id\": \"r\", \"steps\": [{\"id\": \"x\", \"type\": \"handoff\"}]}"));

        Step step = run.steps.get(0);
        assertEquals("handoff", step.name);
        assertNull(step.perceptionState);
        assertNull(step.actionState);
        assertNotNull(step.completeState);
        assertEquals(StateLayer.ExecutionPhase.PERCEPTION, step.completeState.executionState.phase);
    }

    @Test
    void malformedStepTimestampNamesStepIndex() {
        MalformedTimestampException ex = assertThrows(MalformedTimestampException.class, () -> connector.convert(json("""
            {"id": "r", "steps": [{"type": "message", "timestamp": "2024-01-01T00:00:00Z"},
                                  {"type": "message", "timestamp": "01/02/2024"}]}
            """)));

        assertEquals("$.steps[1].timestamp", ex.getPath());
        assertEquals("01/02/2024", ex.getValue());
    }

    @Test
    void malformedRunTimestampIsAHardFailure() {
        MalformedTimestampException ex = assertThrows(MalformedTimestampException.class,
                () -> connector.convert(json("{\"id\": \"r\", \"started_at\": \"noon\"}")));
        assertEquals("$.started_at", ex.getPath());
    }

    @Test
    void nonObjectToolInputIsRejected() {
        ValidationException ex = assertThrows(ValidationException.class, () -> connector.convert(json("""
            {"id": "r", "steps": [{"type": "tool", "tool_name": "t", "input": "raw text"}]}
            """)));
        assertEquals("$.steps[0].input", ex.getPath());
    }

    @Test
    void nonArrayStepsAreRejected() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> connector.convert(json("{\"id\": \"r\", \"steps\": {}}")));
        assertEquals("$.steps", ex.getPath());
    }

    @Test
    void configOverridesLiterals() {
        ConnectorConfig config = new Gson().fromJson("""
            {"interface_id": "chat-ui", "default_role": "user", "default_model_id": "local-llm",
             "capability_version": "2.0.0", "created_by": "importer"}
            """, ConnectorConfig.class);
        OpenAiTraceConnector custom = new OpenAiTraceConnector(config, Clock.fixed(FROZEN, ZoneOffset.UTC));

        Run run = custom.convert(json("""
            {"id": "r", "steps": [{"type": "message", "content": "q"}, {"type": "tool", "tool_name": "t"}]}
            """));

        InteractionLayer.Message message = run.steps.get(0).interactionState.recentMessages.get(0);
        assertEquals("chat-ui", message.interfaceId);
        assertEquals(InteractionLayer.MessageType.REQUEST, message.type);
        assertEquals(new JsonPrimitive("user"),
                run.steps.get(0).perceptionState.currentObservations.get(0).metadata.get("role"));
        assertEquals("local-llm", run.agent.configuration.modelId);
        assertEquals("2.0.0", run.agent.capabilities.get(0).version);
        assertEquals("importer", run.agent.metadata.createdBy);
    }

    @Test
    void convertedRunSurvivesSerializerRoundTrip() throws IOException {
        Run run = connector.convert(sample());
        OntologySerializer serializer = new OntologySerializer();

        Run back = serializer.fromJson(serializer.toJson(run));

        assertEquals(run, back);
        assertEquals(run.steps.get(0).interactionState.recentMessages.get(0).content,
                back.steps.get(0).interactionState.recentMessages.get(0).content);
    }
}
