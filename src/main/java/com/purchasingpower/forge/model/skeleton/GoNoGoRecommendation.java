package com.purchasingpower.forge.model.skeleton;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum GoNoGoRecommendation {
    @JsonProperty("go") GO,
    @JsonProperty("conditional_go") CONDITIONAL_GO,
    @JsonProperty("pivot") PIVOT,
    @JsonProperty("no_go") NO_GO
}
