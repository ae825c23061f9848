package com.purchasingpower.forge.model.assumption;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum AssumptionCategory {
    @JsonProperty("value") VALUE,
    @JsonProperty("technical") TECHNICAL,
    @JsonProperty("stakeholder_dependency") STAKEHOLDER_DEPENDENCY,
    @JsonProperty("market") MARKET,
    @JsonProperty("organizational") ORGANIZATIONAL
}
