package com.purchasingpower.forge.agent.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.forge.model.assumption.AssumptionStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record UpdateAssumptionStatusCommand(
        @NotBlank @JsonProperty("assumption_id") String assumptionId,
        @NotNull @JsonProperty("new_status") AssumptionStatus newStatus,
        @NotBlank String reason
) {
}
