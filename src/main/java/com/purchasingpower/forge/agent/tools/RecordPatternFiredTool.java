package com.purchasingpower.forge.agent.tools;

import com.purchasingpower.forge.agent.Tool;
import com.purchasingpower.forge.agent.ToolCommandBinder;
import com.purchasingpower.forge.agent.ToolContext;
import com.purchasingpower.forge.agent.ToolResult;
import com.purchasingpower.forge.agent.command.RecordPatternFiredCommand;
import com.purchasingpower.forge.knowledge.KnowledgeIndex;
import com.purchasingpower.forge.model.knowledge.GuidanceKind;
import com.purchasingpower.forge.model.knowledge.GuidanceUnit;
import com.purchasingpower.forge.model.routing.GuidanceFiring;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class RecordPatternFiredTool implements Tool {

    private final ToolCommandBinder binder;
    private final KnowledgeIndex knowledgeIndex;

    @Override
    public String getName() {
        return "record_pattern_fired";
    }

    @Override
    public String getDescription() {
        return "Record that a pattern was recognised in what the user said, and what triggered it.";
    }

    @Override
    public String getParameterSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "pattern_name": {"type": "string"},
                    "trigger_reason": {"type": "string"}
                  },
                  "required": ["pattern_name", "trigger_reason"]
                }
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.ROUTING;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        RecordPatternFiredCommand command = binder.bind(getName(), parameters, RecordPatternFiredCommand.class);
        String name = knowledgeIndex.lookup(GuidanceKind.PATTERN, command.patternName())
                .map(GuidanceUnit::key)
                .orElseGet(() -> {
                    log.debug("Pattern '{}' is not in the catalogue, recording as given", command.patternName());
                    return command.patternName().trim();
                });

        context.getState().getRoutingContext().getPatternsFired().add(GuidanceFiring.builder()
                .name(name)
                .note(command.triggerReason())
                .turn(context.getTurnNumber())
                .build());
        context.recordMutation("pattern " + name);
        return ToolResult.success("Recorded pattern fired: " + name);
    }
}
