package com.agentlog.ontology.run;

import com.agentlog.ontology.layer.ActionLayer;
import com.agentlog.ontology.layer.CognitionLayer;
import com.agentlog.ontology.layer.InteractionLayer;
import com.agentlog.ontology.layer.OversightLayer;
import com.agentlog.ontology.layer.PerceptionLayer;
import com.agentlog.ontology.layer.StateLayer;
import com.agentlog.ontology.schema.OpenEntity;
import com.google.gson.JsonElement;
import com.google.gson.annotations.SerializedName;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One unit of agent activity within a run.
 *
 * Each layer snapshot is optional; a step only carries the layers it touched.
 * Sub-steps are owned exclusively by this step. When both times are set,
 * {@code duration} should equal their difference, but nothing recomputes it.
 */
public class Step extends OpenEntity {

    @SerializedName("id")                public String id;
    @SerializedName("name")              public String name;
    @SerializedName("step_number")       public int stepNumber;
    @SerializedName("parent_step_id")    public String parentStepId;
    @SerializedName("start_time")        public OffsetDateTime startTime;
    @SerializedName("end_time")          public OffsetDateTime endTime;
    @SerializedName("duration")          public Double duration;  // seconds

    @SerializedName("perception_state")  public PerceptionLayer.PerceptionSnapshot perceptionState;
    @SerializedName("cognition_state")   public CognitionLayer.CognitionSnapshot cognitionState;
    @SerializedName("action_state")      public ActionLayer.ActionSnapshot actionState;
    @SerializedName("complete_state")    public StateLayer.CompleteState completeState;
    @SerializedName("interaction_state") public InteractionLayer.InteractionSnapshot interactionState;
    @SerializedName("oversight_state")   public OversightLayer.OversightSnapshot oversightState;

    @SerializedName("inputs")            public Map<String, JsonElement> inputs = new LinkedHashMap<>();
    @SerializedName("outputs")           public Map<String, JsonElement> outputs = new LinkedHashMap<>();
    @SerializedName("metadata")          public Map<String, JsonElement> metadata = new LinkedHashMap<>();
    @SerializedName("sub_steps")         public List<Step> subSteps = new ArrayList<>();

    /** Appends {@code child} as the last sub-step and points its parent id at this step. */
    public Step addSubStep(Step child) {
        child.parentStepId = id;
        subSteps.add(child);
        return child;
    }

    @Override
    public void validate() {
        require("id", id);
        require("name", name);
        require("start_time", startTime);
        requireNoNulls("sub_steps", subSteps);
    }
}
