package com.purchasingpower.forge.agent.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record RecordPatternFiredCommand(
        @NotBlank @JsonProperty("pattern_name") String patternName,
        @NotBlank @JsonProperty("trigger_reason") String triggerReason
) {
}
