package com.purchasingpower.forge.agent.tools;

import com.purchasingpower.forge.agent.Tool;
import com.purchasingpower.forge.agent.ToolCommandBinder;
import com.purchasingpower.forge.agent.ToolContext;
import com.purchasingpower.forge.agent.ToolResult;
import com.purchasingpower.forge.agent.command.UpdateAssumptionConfidenceCommand;
import com.purchasingpower.forge.util.WireNames;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class UpdateAssumptionConfidenceTool implements Tool {

    private final ToolCommandBinder binder;

    @Override
    public String getName() {
        return "update_assumption_confidence";
    }

    @Override
    public String getDescription() {
        return "Change how well-supported an assumption is, without changing its status.";
    }

    @Override
    public String getParameterSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "assumption_id": {"type": "string"},
                    "new_confidence": {"type": "string", "enum": ["validated", "informed", "guessed"]},
                    "reason": {"type": "string"}
                  },
                  "required": ["assumption_id", "new_confidence", "reason"]
                }
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.FACT_STORE;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        UpdateAssumptionConfidenceCommand command = binder.bind(getName(), parameters, UpdateAssumptionConfidenceCommand.class);
        String id = command.assumptionId().trim();
        String confidence = WireNames.of(command.newConfidence());

        boolean changed = context.getFactStore().updateConfidence(
                id, command.newConfidence(), command.reason(), context.getTurnNumber());
        if (!changed) {
            return ToolResult.success(id + " already " + confidence + ", nothing changed");
        }
        context.recordMutation(id + " confidence -> " + confidence);
        return ToolResult.success("Updated " + id + " confidence to " + confidence + ": " + command.reason());
    }
}
