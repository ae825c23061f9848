package com.purchasingpower.forge.agent.tools;

import com.purchasingpower.forge.agent.Tool;
import com.purchasingpower.forge.agent.ToolCommandBinder;
import com.purchasingpower.forge.agent.ToolContext;
import com.purchasingpower.forge.agent.ToolResult;
import com.purchasingpower.forge.agent.command.AddDecisionCriterionCommand;
import com.purchasingpower.forge.util.WireNames;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class AddDecisionCriteriaTool implements Tool {

    private final ToolCommandBinder binder;

    @Override
    public String getName() {
        return "add_decision_criteria";
    }

    @Override
    public String getDescription() {
        return "Add a condition under which the work is worth pursuing (proceed_if) or not (do_not_proceed_if).";
    }

    @Override
    public String getParameterSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "criteria_type": {"type": "string", "enum": ["proceed_if", "do_not_proceed_if"]},
                    "condition": {"type": "string"}
                  },
                  "required": ["criteria_type", "condition"]
                }
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.SKELETON;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        AddDecisionCriterionCommand command = binder.bind(getName(), parameters, AddDecisionCriterionCommand.class);
        String type = WireNames.of(command.criteriaType());
        String condition = command.condition().trim();

        if (!context.getFactStore().addDecisionCriterion(command.criteriaType(), condition)) {
            return ToolResult.success("Already recorded under " + type + ": " + condition);
        }
        context.recordMutation(type + " criterion");
        return ToolResult.success("Added " + type + ": " + condition);
    }
}
