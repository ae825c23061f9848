package com.purchasingpower.forge.model.skeleton;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ValidationApproach {
    @JsonProperty("painted_door") PAINTED_DOOR,
    @JsonProperty("concierge") CONCIERGE,
    @JsonProperty("technical_spike") TECHNICAL_SPIKE,
    @JsonProperty("wizard_of_oz") WIZARD_OF_OZ,
    @JsonProperty("prototype") PROTOTYPE,
    @JsonProperty("other") OTHER
}
