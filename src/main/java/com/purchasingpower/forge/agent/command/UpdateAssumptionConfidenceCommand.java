package com.purchasingpower.forge.agent.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.forge.model.assumption.Confidence;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record UpdateAssumptionConfidenceCommand(
        @NotBlank @JsonProperty("assumption_id") String assumptionId,
        @NotNull @JsonProperty("new_confidence") Confidence newConfidence,
        @NotBlank String reason
) {
}
