package com.purchasingpower.forge.agent.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record CompleteModeCommand(
        @NotBlank @JsonProperty("mode_completed") String modeCompleted,
        @NotBlank String summary
) {
}
