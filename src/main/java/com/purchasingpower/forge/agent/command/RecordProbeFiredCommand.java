package com.purchasingpower.forge.agent.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record RecordProbeFiredCommand(
        @NotBlank @JsonProperty("probe_name") String probeName,
        String summary
) {
}
