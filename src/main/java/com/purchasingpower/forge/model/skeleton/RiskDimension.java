package com.purchasingpower.forge.model.skeleton;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The four product risk dimensions assessed during solution evaluation.
 */
public enum RiskDimension {
    @JsonProperty("value") VALUE("Value Risk"),
    @JsonProperty("usability") USABILITY("Usability Risk"),
    @JsonProperty("feasibility") FEASIBILITY("Feasibility Risk"),
    @JsonProperty("viability") VIABILITY("Viability Risk");

    private final String displayName;

    RiskDimension(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
