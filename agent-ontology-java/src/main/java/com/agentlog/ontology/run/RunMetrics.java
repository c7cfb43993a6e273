package com.agentlog.ontology.run;

import java.util.Map;

/**
 * Summary figures for one run.
 *
 * @param totalSteps         number of top-level steps
 * @param totalDuration      run duration in seconds, 0 when unknown
 * @param successRate        always 0; no success signal is recorded per step yet
 * @param performanceMetrics copy of the run's own performance metrics
 */
public record RunMetrics(
        int totalSteps,
        double totalDuration,
        double averageStepDuration,
        int maxNestingDepth,
        double successRate,
        Map<String, Double> performanceMetrics
) {}
