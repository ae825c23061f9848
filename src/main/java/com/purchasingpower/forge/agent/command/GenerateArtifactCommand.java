package com.purchasingpower.forge.agent.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.forge.artifact.ArtifactType;
import jakarta.validation.constraints.NotNull;

public record GenerateArtifactCommand(@NotNull @JsonProperty("artifact_type") ArtifactType artifactType) {
}
