package com.agentlog.connector;

/**
 * Deterministic ids for entities the connector synthesizes:
 *   step-<index>                          step without an id in the trace
 *   <step>-obs / -signal / -tool / -plan  per-step perception and action records
 *   <agent>-state-<suffix>                state records, suffix = step id or "initial"
 *   tool:<tool_name>                      agent capability
 */
public final class TraceIds {

    public static final String INITIAL = "initial";

    private TraceIds() {}

    public static String step(String traceStepId, int index) {
        return traceStepId != null ? traceStepId : "step-" + index;
    }

    public static String observation(String stepId) { return stepId + "-obs"; }
    public static String signal(String stepId)      { return stepId + "-signal"; }
    public static String toolInvocation(String stepId) { return stepId + "-tool"; }
    public static String actionPlan(String stepId)  { return stepId + "-plan"; }

    public static String nlpProcessor(String agentId) { return agentId + "-nlp-processor"; }

    public static String agentState(String agentId, String suffix)      { return agentId + "-state-" + suffix; }
    public static String executionState(String agentId, String suffix)  { return agentId + "-exec-" + suffix; }
    public static String cognitiveState(String agentId, String suffix)  { return agentId + "-cog-" + suffix; }
    public static String perceptualState(String agentId, String suffix) { return agentId + "-percept-" + suffix; }

    public static String capability(String toolName) {
        return "tool:" + toolName;
    }
}
