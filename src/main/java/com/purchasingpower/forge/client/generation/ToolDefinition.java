package com.purchasingpower.forge.client.generation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * @param parameters JSON schema of the tool input
 */
public record ToolDefinition(String name, String description, JsonNode parameters) {
}
