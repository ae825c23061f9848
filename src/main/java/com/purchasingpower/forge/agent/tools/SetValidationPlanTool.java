package com.purchasingpower.forge.agent.tools;

import com.purchasingpower.forge.agent.Tool;
import com.purchasingpower.forge.agent.ToolCommandBinder;
import com.purchasingpower.forge.agent.ToolContext;
import com.purchasingpower.forge.agent.ToolResult;
import com.purchasingpower.forge.agent.command.SetValidationPlanCommand;
import com.purchasingpower.forge.util.WireNames;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class SetValidationPlanTool implements Tool {

    private final ToolCommandBinder binder;

    @Override
    public String getName() {
        return "set_validation_plan";
    }

    @Override
    public String getDescription() {
        return "Record the cheapest experiment that tests the riskiest assumption before anything is built.";
    }

    @Override
    public String getParameterSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "riskiest_assumption": {"type": "string", "description": "Assumption id, e.g. A2"},
                    "approach": {"type": "string", "enum": ["painted_door", "concierge", "technical_spike", "wizard_of_oz", "prototype", "other"]},
                    "description": {"type": "string"},
                    "timeline": {"type": "string"},
                    "success_criteria": {"type": "string"}
                  },
                  "required": ["riskiest_assumption", "approach", "description", "success_criteria"]
                }
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.SKELETON;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        SetValidationPlanCommand command = binder.bind(getName(), parameters, SetValidationPlanCommand.class);
        context.getFactStore().setValidationPlan(command.toPlan());
        context.recordMutation("validation plan");
        return ToolResult.success("Validation plan set: " + WireNames.of(command.approach())
                + " for " + command.riskiestAssumption().trim());
    }
}
