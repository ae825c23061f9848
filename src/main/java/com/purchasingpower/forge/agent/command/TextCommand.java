package com.purchasingpower.forge.agent.command;

import jakarta.validation.constraints.NotBlank;

/**
 * Single free-text field, shared by the problem statement and target audience tools.
 */
public record TextCommand(@NotBlank String text) {
}
