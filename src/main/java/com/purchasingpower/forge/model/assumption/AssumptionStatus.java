package com.purchasingpower.forge.model.assumption;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle of an assumption. Assumptions are never deleted, only moved between these states.
 */
public enum AssumptionStatus {
    @JsonProperty("active") ACTIVE,
    @JsonProperty("at_risk") @JsonAlias("at-risk") AT_RISK,
    @JsonProperty("invalidated") INVALIDATED,
    @JsonProperty("confirmed") CONFIRMED
}
