package com.agentlog.ontology.run;

import java.time.OffsetDateTime;

/**
 * Start or end of one step on the flattened run timeline.
 *
 * @param depth nesting depth of the step, 0 for top-level steps
 */
public record TimelineEvent(
        Kind kind,
        OffsetDateTime timestamp,
        String stepId,
        String stepName,
        int depth
) {
    public enum Kind {
        STEP_START("step_start"),
        STEP_END("step_end");

        private final String label;
        Kind(String label) { this.label = label; }

        public String label() { return label; }
    }
}
