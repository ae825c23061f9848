package com.purchasingpower.forge.agent.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.forge.model.skeleton.ValidationApproach;
import com.purchasingpower.forge.model.skeleton.ValidationPlan;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record SetValidationPlanCommand(
        @NotBlank @JsonProperty("riskiest_assumption") String riskiestAssumption,
        @NotNull ValidationApproach approach,
        @NotBlank String description,
        String timeline,
        @NotBlank @JsonProperty("success_criteria") String successCriteria
) {

    public ValidationPlan toPlan() {
        return ValidationPlan.builder()
                .riskiestAssumption(riskiestAssumption.trim())
                .approach(approach)
                .description(description)
                .timeline(timeline)
                .successCriteria(successCriteria)
                .build();
    }
}
