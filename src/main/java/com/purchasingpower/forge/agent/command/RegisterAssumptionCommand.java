package com.purchasingpower.forge.agent.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.forge.model.assumption.AssumptionCategory;
import com.purchasingpower.forge.model.assumption.Confidence;
import com.purchasingpower.forge.model.assumption.Impact;
import com.purchasingpower.forge.model.assumption.NewAssumption;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record RegisterAssumptionCommand(
        @NotBlank String claim,
        @NotNull @JsonProperty("type") AssumptionCategory category,
        @NotNull Impact impact,
        @NotNull Confidence confidence,
        @NotBlank String basis,
        @NotBlank @JsonProperty("surfaced_by") String surfacedBy,
        @JsonProperty("depends_on") List<String> dependsOn,
        @JsonProperty("recommended_action") String recommendedAction,
        @JsonProperty("implied_stakeholders") List<String> impliedStakeholders
) {

    public NewAssumption toNewAssumption() {
        return NewAssumption.builder()
                .claim(claim)
                .category(category)
                .impact(impact)
                .confidence(confidence)
                .basis(basis)
                .surfacedBy(surfacedBy)
                .recommendedAction(recommendedAction)
                .dependsOn(dependsOn)
                .impliedStakeholders(impliedStakeholders)
                .build();
    }
}
