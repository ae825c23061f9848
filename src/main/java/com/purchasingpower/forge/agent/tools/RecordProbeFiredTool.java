package com.purchasingpower.forge.agent.tools;

import com.purchasingpower.forge.agent.Tool;
import com.purchasingpower.forge.agent.ToolCommandBinder;
import com.purchasingpower.forge.agent.ToolContext;
import com.purchasingpower.forge.agent.ToolResult;
import com.purchasingpower.forge.agent.command.RecordProbeFiredCommand;
import com.purchasingpower.forge.knowledge.KnowledgeIndex;
import com.purchasingpower.forge.model.knowledge.GuidanceKind;
import com.purchasingpower.forge.model.knowledge.GuidanceUnit;
import com.purchasingpower.forge.model.routing.GuidanceFiring;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Appends to the probes-fired history so the router does not repeat itself. Known keys are
 * stored under their canonical spelling.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecordProbeFiredTool implements Tool {

    private final ToolCommandBinder binder;
    private final KnowledgeIndex knowledgeIndex;

    @Override
    public String getName() {
        return "record_probe_fired";
    }

    @Override
    public String getDescription() {
        return "Record that a probe was asked this turn, with a one-line summary of what it revealed.";
    }

    @Override
    public String getParameterSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "probe_name": {"type": "string"},
                    "summary": {"type": "string"}
                  },
                  "required": ["probe_name"]
                }
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.ROUTING;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        RecordProbeFiredCommand command = binder.bind(getName(), parameters, RecordProbeFiredCommand.class);
        String name = knowledgeIndex.lookup(GuidanceKind.PROBE, command.probeName())
                .map(GuidanceUnit::key)
                .orElseGet(() -> {
                    log.debug("Probe '{}' is not in the catalogue, recording as given", command.probeName());
                    return command.probeName().trim();
                });

        context.getState().getRoutingContext().getProbesFired().add(GuidanceFiring.builder()
                .name(name)
                .note(command.summary() == null ? "" : command.summary())
                .turn(context.getTurnNumber())
                .build());
        context.recordMutation("probe " + name);
        return ToolResult.success("Recorded probe fired: " + name);
    }
}
