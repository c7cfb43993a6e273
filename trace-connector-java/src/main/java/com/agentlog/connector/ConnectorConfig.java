package com.agentlog.connector;

import com.google.gson.annotations.SerializedName;

/**
 * Literals the connector falls back on when a trace leaves them out.
 * Every key is optional; an empty JSON object yields the defaults.
 */
public class ConnectorConfig {

    @SerializedName("default_model_id")
    private String defaultModelId;

    /** Interface id stamped on every converted message (default: "openai-api"). */
    @SerializedName("interface_id")
    private String interfaceId;

    /** Observation role recorded for message steps without one (default: "assistant"). */
    @SerializedName("default_role")
    private String defaultRole;

    @SerializedName("capability_version")
    private String capabilityVersion;

    @SerializedName("created_by")
    private String createdBy;

    public static ConnectorConfig defaults() {
        return new ConnectorConfig();
    }

    public String getDefaultModelId()    { return defaultModelId    != null ? defaultModelId    : "gpt-4"; }
    public String getInterfaceId()       { return interfaceId       != null ? interfaceId       : "openai-api"; }
    public String getDefaultRole()       { return defaultRole       != null ? defaultRole       : "assistant"; }
    public String getCapabilityVersion() { return capabilityVersion != null ? capabilityVersion : "1.0.0"; }
    public String getCreatedBy()         { return createdBy         != null ? createdBy         : "openai"; }
}
