package com.purchasingpower.forge.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.forge.client.generation.ToolDefinition;
import com.purchasingpower.forge.exception.AssumptionNotFoundException;
import com.purchasingpower.forge.exception.InvalidToolArgumentsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Routes each tool call to exactly one {@link Tool}.
 *
 * <p>Failures never escape: unknown tools, bad arguments and unknown ids come back to the model
 * as an error result it can correct on its next iteration.
 */
@Slf4j
@Component
public class ToolDispatcher {

    private final Map<String, Tool> tools = new LinkedHashMap<>();
    private final List<ToolDefinition> definitions = new ArrayList<>();

    public ToolDispatcher(List<Tool> tools, ObjectMapper objectMapper) {
        for (Tool tool : tools) {
            Tool previous = this.tools.putIfAbsent(tool.getName(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name '" + tool.getName() + "': "
                        + previous.getClass().getSimpleName() + " and " + tool.getClass().getSimpleName());
            }
            try {
                definitions.add(new ToolDefinition(
                        tool.getName(), tool.getDescription(), objectMapper.readTree(tool.getParameterSchema())));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Invalid parameter schema for tool " + tool.getName(), e);
            }
        }
        log.info("Registered {} tools: {}", this.tools.size(), this.tools.keySet());
    }

    public List<ToolDefinition> definitions() {
        return List.copyOf(definitions);
    }

    public Set<String> toolNames() {
        return Set.copyOf(tools.keySet());
    }

    public ToolResult dispatch(String toolName, Map<String, Object> parameters, ToolContext context) {
        Tool tool = tools.get(toolName);
        if (tool == null) {
            log.warn("Unknown tool '{}'. Valid tools: {}", toolName, tools.keySet());
            return ToolResult.failure("Unknown tool: " + toolName + ". Valid tools: " + String.join(", ", tools.keySet()));
        }

        log.info("Executing tool: {}", toolName);
        try {
            ToolResult result = tool.execute(parameters, context);
            log.debug("Tool {} -> {}: {}", toolName, result.isSuccess() ? "ok" : "failed", result.getMessage());
            return result;
        } catch (InvalidToolArgumentsException | AssumptionNotFoundException | IllegalArgumentException e) {
            log.info("Tool {} rejected: {}", toolName, e.getMessage());
            return ToolResult.failure("Error: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Tool {} failed", toolName, e);
            return ToolResult.failure("Tool " + toolName + " failed: " + e.getMessage());
        }
    }
}
