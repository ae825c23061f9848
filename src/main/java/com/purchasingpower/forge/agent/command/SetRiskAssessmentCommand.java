package com.purchasingpower.forge.agent.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.forge.model.skeleton.RiskAssessment;
import com.purchasingpower.forge.model.skeleton.RiskDimension;
import com.purchasingpower.forge.model.skeleton.RiskLevel;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;

public record SetRiskAssessmentCommand(
        @NotNull RiskDimension dimension,
        @NotNull RiskLevel level,
        @NotBlank String summary,
        @JsonProperty("evidence_for") List<String> evidenceFor,
        @JsonProperty("evidence_against") List<String> evidenceAgainst
) {

    public RiskAssessment toAssessment() {
        return RiskAssessment.builder()
                .dimension(dimension)
                .level(level)
                .summary(summary)
                .evidenceFor(evidenceFor == null ? new ArrayList<>() : new ArrayList<>(evidenceFor))
                .evidenceAgainst(evidenceAgainst == null ? new ArrayList<>() : new ArrayList<>(evidenceAgainst))
                .build();
    }
}
