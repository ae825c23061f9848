package com.purchasingpower.forge.agent.command;

import com.purchasingpower.forge.model.skeleton.StakeholderType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record AddStakeholderCommand(
        @NotBlank String name,
        @NotNull StakeholderType type,
        Boolean validated,
        String notes
) {

    public boolean isValidated() {
        return Boolean.TRUE.equals(validated);
    }
}
