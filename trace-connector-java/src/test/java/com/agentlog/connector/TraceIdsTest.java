package com.agentlog.connector;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TraceIdsTest {

    @Test
    void traceIdsAreDerivedFromStepId() {
        assertEquals("step-4", TraceIds.step(null, 4));
        assertEquals("s", TraceIds.step("s", 4));
        assertEquals("s-obs", TraceIds.observation("s"));
        assertEquals("a-percept-initial", TraceIds.perceptualState("a", TraceIds.INITIAL));
        assertEquals("tool:search", TraceIds.capability("search"));
    }
}
