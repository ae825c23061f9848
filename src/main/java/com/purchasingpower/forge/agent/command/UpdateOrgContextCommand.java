package com.purchasingpower.forge.agent.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record UpdateOrgContextCommand(
        @NotBlank String company,
        @JsonProperty("public_context") String publicContext,
        @JsonProperty("internal_context") String internalContext,
        @NotBlank String domain
) {
}
