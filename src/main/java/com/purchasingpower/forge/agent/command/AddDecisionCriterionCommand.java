package com.purchasingpower.forge.agent.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.forge.model.skeleton.CriterionType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record AddDecisionCriterionCommand(
        @NotNull @JsonProperty("criteria_type") CriterionType criteriaType,
        @NotBlank String condition
) {
}
