package com.purchasingpower.forge.model.skeleton;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum CriterionType {
    @JsonProperty("proceed_if") PROCEED_IF,
    @JsonProperty("do_not_proceed_if") DO_NOT_PROCEED_IF
}
