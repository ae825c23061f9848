package com.purchasingpower.forge.model.skeleton;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum StakeholderType {
    @JsonProperty("decision_authority") DECISION_AUTHORITY,
    @JsonProperty("pain_holder") PAIN_HOLDER,
    @JsonProperty("status_quo_beneficiary") STATUS_QUO_BENEFICIARY,
    @JsonProperty("execution_dependency") EXECUTION_DEPENDENCY
}
