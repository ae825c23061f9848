package com.purchasingpower.forge.agent.command;

import jakarta.validation.constraints.NotBlank;

public record UpdateConversationSummaryCommand(@NotBlank String summary) {
}
