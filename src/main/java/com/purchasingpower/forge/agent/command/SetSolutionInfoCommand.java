package com.purchasingpower.forge.agent.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record SetSolutionInfoCommand(
        @NotBlank @JsonProperty("solution_name") String solutionName,
        @NotBlank @JsonProperty("solution_description") String solutionDescription,
        @JsonProperty("build_vs_buy") String buildVsBuy
) {
}
