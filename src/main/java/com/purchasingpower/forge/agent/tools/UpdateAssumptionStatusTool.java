package com.purchasingpower.forge.agent.tools;

import com.purchasingpower.forge.agent.Tool;
import com.purchasingpower.forge.agent.ToolCommandBinder;
import com.purchasingpower.forge.agent.ToolContext;
import com.purchasingpower.forge.agent.ToolResult;
import com.purchasingpower.forge.agent.command.UpdateAssumptionStatusCommand;
import com.purchasingpower.forge.model.assumption.CascadeReport;
import com.purchasingpower.forge.util.WireNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Moves an assumption to a new status and reports the dependency cascade.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UpdateAssumptionStatusTool implements Tool {

    private final ToolCommandBinder binder;

    @Override
    public String getName() {
        return "update_assumption_status";
    }

    @Override
    public String getDescription() {
        return "Change an assumption's status when evidence confirms or invalidates it. Invalidating "
                + "flags every active dependent as at_risk; confirming upgrades guessed dependents to informed.";
    }

    @Override
    public String getParameterSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "assumption_id": {"type": "string", "description": "e.g. A3"},
                    "new_status": {"type": "string", "enum": ["active", "at_risk", "invalidated", "confirmed"]},
                    "reason": {"type": "string"}
                  },
                  "required": ["assumption_id", "new_status", "reason"]
                }
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.FACT_STORE;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        UpdateAssumptionStatusCommand command = binder.bind(getName(), parameters, UpdateAssumptionStatusCommand.class);
        CascadeReport report = context.getFactStore().updateStatus(
                command.assumptionId().trim(), command.newStatus(), command.reason(), context.getTurnNumber());

        if (report.changed()) {
            context.recordMutation(report.assumptionId() + " -> " + WireNames.of(report.newStatus())
                    + (report.affected().isEmpty() ? "" : " (cascade: " + report.affected().size() + ")"));
        }
        return ToolResult.success(report.describe(command.reason()));
    }
}
