package com.agentlog.ontology;

import com.agentlog.ontology.layer.CognitionLayer;
import com.agentlog.ontology.layer.StateLayer;
import com.agentlog.ontology.run.Run;
import com.agentlog.ontology.schema.OntologyEnum;
import com.agentlog.ontology.schema.ValidationException;
import com.google.gson.JsonPrimitive;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OpenEntityTest {

    @Test
    void equalityIsStructural() {
        assertEquals(RunFixtures.fullRun(), RunFixtures.fullRun());
        assertEquals(RunFixtures.fullRun().hashCode(), RunFixtures.fullRun().hashCode());
    }

    @Test
    void nestedDifferenceBreaksEquality() {
        Run a = RunFixtures.fullRun();
        Run b = RunFixtures.fullRun();
        b.steps.get(1).subSteps.get(0).name = "renamed";
        assertNotEquals(a, b);
    }

    @Test
    void extraFieldsTakePartInEquality() {
        Run a = RunFixtures.emptyRun("r");
        Run b = RunFixtures.emptyRun("r");
        b.extraFields.put("x", new JsonPrimitive(true));
        assertNotEquals(a, b);
    }

    @Test
    void differentEntityTypesAreNeverEqual() {
        CognitionLayer.Goal goal = new CognitionLayer.Goal();
        CognitionLayer.Plan plan = new CognitionLayer.Plan();
        assertNotEquals(goal, plan);
    }

    @Test
    void toStringListsSetFields() {
        CognitionLayer.Goal goal = new CognitionLayer.Goal();
        goal.id = "g1";
        String text = goal.toString();
        assertTrue(text.startsWith("Goal{"));
        assertTrue(text.contains("id=g1"));
        assertFalse(text.contains("description="));
    }

    @Test
    void validateReportsFirstMissingField() {
        StateLayer.AgentState state = new StateLayer.AgentState();
        state.id = "s";
        ValidationException ex = assertThrows(ValidationException.class, state::validate);
        assertEquals("AgentState", ex.getEntity());
        assertEquals("agent_id", ex.getField());
        assertNull(ex.getPath());
    }

    @Test
    void validFixtureRunPasses() {
        assertDoesNotThrow(() -> RunFixtures.fullRun().validate());
    }

    @Test
    void enumTagLookup() {
        assertEquals(StateLayer.AgentStatus.SHUTTING_DOWN,
                OntologyEnum.fromTag(StateLayer.AgentStatus.class, "shutting-down"));
        assertNull(OntologyEnum.fromTag(StateLayer.AgentStatus.class, "SHUTTING_DOWN"));
    }
}
