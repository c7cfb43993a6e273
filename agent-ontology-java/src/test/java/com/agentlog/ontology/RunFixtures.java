package com.agentlog.ontology;

import com.agentlog.ontology.layer.ActionLayer;
import com.agentlog.ontology.layer.IdentityLayer;
import com.agentlog.ontology.layer.InteractionLayer;
import com.agentlog.ontology.layer.OversightLayer;
import com.agentlog.ontology.layer.PerceptionLayer;
import com.agentlog.ontology.layer.StateLayer;
import com.agentlog.ontology.run.Run;
import com.agentlog.ontology.run.RunStatus;
import com.agentlog.ontology.run.Step;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/** Hand-built runs shared by the ontology tests. */
final class RunFixtures {

    static final OffsetDateTime T0 = OffsetDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

    private RunFixtures() {}

    static OffsetDateTime at(int seconds) {
        return T0.plusSeconds(seconds);
    }

    static IdentityLayer.AgentInstance agent(String id) {
        IdentityLayer.AgentInstance agent = new IdentityLayer.AgentInstance();
        agent.id = id;
        agent.name = "Agent " + id;
        agent.types.add(IdentityLayer.AgentType.CONVERSATIONAL);
        agent.domains.add(IdentityLayer.AgentDomain.GENERAL);

        IdentityLayer.AgentCapability search = new IdentityLayer.AgentCapability();
        search.name = "tool:search";
        agent.capabilities.add(search);

        agent.configuration = new IdentityLayer.AgentConfiguration();
        agent.configuration.modelId = "gpt-4";
        agent.configuration.featureFlags.put("streaming", true);

        agent.metadata = new IdentityLayer.AgentMetadata();
        agent.metadata.createdAt = T0;
        agent.metadata.createdBy = "tests";
        agent.metadata.version = "1.0.0";
        return agent;
    }

    static Run emptyRun(String id) {
        Run run = new Run();
        run.id = id;
        run.name = "Run " + id;
        run.agent = agent("a1");
        run.startTime = T0;
        return run;
    }

    static Step step(String id, OffsetDateTime start, OffsetDateTime end) {
        Step step = new Step();
        step.id = id;
        step.name = "step " + id;
        step.startTime = start;
        step.endTime = end;
        return step;
    }

    static StateLayer.CompleteState completeState(String suffix, OffsetDateTime at) {
        StateLayer.CompleteState state = new StateLayer.CompleteState();
        state.timestamp = at;
        state.agentState = new StateLayer.AgentState();
        state.agentState.id = "a1-state-" + suffix;
        state.agentState.agentId = "a1";
        state.agentState.status = StateLayer.AgentStatus.ACTIVE;
        state.agentState.lastActivity = at;
        state.agentState.configurationHash = "active";
        state.executionState = new StateLayer.ExecutionState();
        state.executionState.id = "a1-exec-" + suffix;
        state.executionState.phase = StateLayer.ExecutionPhase.EXECUTION;
        state.cognitiveState = new StateLayer.CognitiveState();
        state.cognitiveState.id = "a1-cog-" + suffix;
        state.perceptualState = new StateLayer.PerceptualState();
        state.perceptualState.id = "a1-percept-" + suffix;
        state.perceptualState.sensorReadings.put("last_input", new JsonPrimitive("hi"));
        return state;
    }

    /** A run touching every layer, with one nested sub-step. */
    static Run fullRun() {
        Run run = emptyRun("r1");
        run.endTime = at(10);
        run.duration = 10.0;
        run.status = RunStatus.COMPLETED;
        run.success = true;
        run.tags.add("fixture");
        run.performanceMetrics.put("latency_ms", 12.5);
        run.initialState = completeState("initial", T0);

        Step message = run.addStep(step("s1", at(1), at(2)));
        message.duration = 1.0;
        PerceptionLayer.Observation obs = new PerceptionLayer.Observation();
        obs.id = "s1-obs";
        obs.processorId = "a1-nlp-processor";
        obs.signalIds.add("s1-signal");
        obs.type = "text-message";
        obs.content = new JsonPrimitive("hi");
        obs.timestamp = at(1);
        obs.metadata.put("role", new JsonPrimitive("user"));
        message.perceptionState = new PerceptionLayer.PerceptionSnapshot();
        message.perceptionState.timestamp = at(1);
        message.perceptionState.currentObservations.add(obs);

        InteractionLayer.Message msg = new InteractionLayer.Message();
        msg.id = "s1";
        msg.type = InteractionLayer.MessageType.REQUEST;
        msg.senderId = "user";
        msg.recipientId = "a1";
        msg.interfaceId = "openai-api";
        msg.content = new JsonPrimitive("hi");
        msg.timestamp = at(1);
        message.interactionState = new InteractionLayer.InteractionSnapshot();
        message.interactionState.timestamp = at(1);
        message.interactionState.recentMessages.add(msg);
        message.completeState = completeState("s1", at(1));

        Step tool = run.addStep(step("s2", at(3), at(5)));
        tool.duration = 2.0;
        JsonObject output = new JsonObject();
        output.addProperty("r", "one");
        ActionLayer.ToolInvocation invocation = new ActionLayer.ToolInvocation();
        invocation.id = "s2-tool";
        invocation.toolName = "search";
        invocation.actionExecutionId = "s2";
        invocation.inputParameters.put("q", new JsonPrimitive("x"));
        invocation.outputData = output;
        invocation.startTime = at(3);
        invocation.endTime = at(3);
        ActionLayer.ActionExecution execution = new ActionLayer.ActionExecution();
        execution.id = "s2";
        execution.actionPlanId = "s2-plan";
        execution.status = ActionLayer.ActionStatus.COMPLETED;
        execution.startTime = at(3);
        execution.endTime = at(3);
        execution.executorId = "a1";
        execution.results = output.deepCopy();
        execution.toolInvocations.add(invocation);
        tool.actionState = new ActionLayer.ActionSnapshot();
        tool.actionState.timestamp = at(3);
        tool.actionState.completedActions.add(execution);

        OversightLayer.Anomaly anomaly = new OversightLayer.Anomaly();
        anomaly.id = "an1";
        anomaly.type = OversightLayer.AnomalyType.DATA_QUALITY;
        anomaly.severity = OversightLayer.RiskLevel.LOW;
        anomaly.detectedAt = at(4);
        anomaly.component = "search";
        anomaly.description = "empty result";
        anomaly.confidence = 0.4;
        tool.oversightState = new OversightLayer.OversightSnapshot();
        tool.oversightState.timestamp = at(4);
        tool.oversightState.activeAnomalies.add(anomaly);
        tool.oversightState.oversightHealth = 0.9;
        tool.completeState = completeState("s2", at(3));

        Step nested = tool.addSubStep(step("s2.1", at(4), null));
        nested.metadata.put("note", new JsonPrimitive("retry"));

        run.finalState = tool.completeState;
        run.totalMessages = 1;
        run.totalActions = 1;
        run.totalObservations = 2;
        return run;
    }
}
