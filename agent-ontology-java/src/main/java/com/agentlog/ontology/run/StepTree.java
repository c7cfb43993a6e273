package com.agentlog.ontology.run;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Read-only queries over the step forest of a {@link Run}.
 *
 * Every traversal is depth-first pre-order in list order: a step is visited
 * before its sub-steps, and siblings in the order they were added.
 */
public final class StepTree {

    private StepTree() {}

    /**
     * Finds the first step, at any depth, whose id equals {@code stepId}.
     */
    public static Optional<Step> findStepById(Run run, String stepId) {
        if (stepId == null) return Optional.empty();
        return find(run.steps, stepId);
    }

    private static Optional<Step> find(List<Step> steps, String stepId) {
        for (Step step : steps) {
            if (stepId.equals(step.id)) return Optional.of(step);
            Optional<Step> nested = find(step.subSteps, stepId);
            if (nested.isPresent()) return nested;
        }
        return Optional.empty();
    }

    /**
     * Flattens the forest into start and end events sorted by instant.
     * Events at the same instant keep depth-first emission order.
     */
    public static List<TimelineEvent> timeline(Run run) {
        List<TimelineEvent> events = new ArrayList<>();
        collectEvents(run.steps, 0, events);
        events.sort(Comparator.comparing(TimelineEvent::timestamp, OffsetDateTime.timeLineOrder()));
        return events;
    }

    private static void collectEvents(List<Step> steps, int depth, List<TimelineEvent> out) {
        for (Step step : steps) {
            out.add(new TimelineEvent(TimelineEvent.Kind.STEP_START, step.startTime, step.id, step.name, depth));
            if (step.endTime != null) {
                out.add(new TimelineEvent(TimelineEvent.Kind.STEP_END, step.endTime, step.id, step.name, depth));
            }
            collectEvents(step.subSteps, depth + 1, out);
        }
    }

    /**
     * Depth of the deepest sub-step chain: 0 without steps, 1 when every step is top-level.
     */
    public static int maxNestingDepth(Run run) {
        return depth(run.steps);
    }

    private static int depth(List<Step> steps) {
        int max = 0;
        for (Step step : steps) {
            max = Math.max(max, 1 + depth(step.subSteps));
        }
        return max;
    }

    /** Mean duration over all steps that have one; 0 if none do. */
    public static double averageStepDuration(Run run) {
        double[] acc = new double[2];  // sum, count
        accumulateDurations(run.steps, acc);
        return acc[1] == 0 ? 0.0 : acc[0] / acc[1];
    }

    private static void accumulateDurations(List<Step> steps, double[] acc) {
        for (Step step : steps) {
            if (step.duration != null) {
                acc[0] += step.duration;
                acc[1]++;
            }
            accumulateDurations(step.subSteps, acc);
        }
    }

    /** Number of steps including all sub-steps. */
    public static int countSteps(Run run) {
        return count(run.steps);
    }

    private static int count(List<Step> steps) {
        int n = 0;
        for (Step step : steps) {
            n += 1 + count(step.subSteps);
        }
        return n;
    }

    public static RunMetrics calculateMetrics(Run run) {
        return new RunMetrics(
                run.steps.size(),
                run.duration != null ? run.duration : 0.0,
                averageStepDuration(run),
                maxNestingDepth(run),
                0.0,
                new LinkedHashMap<>(run.performanceMetrics)
        );
    }
}
