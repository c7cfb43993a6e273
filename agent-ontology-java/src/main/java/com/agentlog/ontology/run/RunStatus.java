package com.agentlog.ontology.run;

import com.agentlog.ontology.schema.OntologyEnum;

public enum RunStatus implements OntologyEnum {
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled"),
    UNKNOWN("unknown");

    private final String tag;
    RunStatus(String tag) { this.tag = tag; }
    @Override public String tag() { return tag; }
}
