package com.purchasingpower.forge.agent.tools;

import com.purchasingpower.forge.agent.Tool;
import com.purchasingpower.forge.agent.ToolCommandBinder;
import com.purchasingpower.forge.agent.ToolContext;
import com.purchasingpower.forge.agent.ToolResult;
import com.purchasingpower.forge.agent.command.AddStakeholderCommand;
import com.purchasingpower.forge.model.skeleton.Stakeholder;
import com.purchasingpower.forge.util.WireNames;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class AddStakeholderTool implements Tool {

    private final ToolCommandBinder binder;

    @Override
    public String getName() {
        return "add_stakeholder";
    }

    @Override
    public String getDescription() {
        return "Add a person or group to the stakeholder map. Adding the same name and type twice "
                + "returns the existing entry.";
    }

    @Override
    public String getParameterSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "name": {"type": "string"},
                    "type": {"type": "string", "enum": ["decision_authority", "pain_holder", "status_quo_beneficiary", "execution_dependency"]},
                    "validated": {"type": "boolean", "description": "True when the user has confirmed their role"},
                    "notes": {"type": "string"}
                  },
                  "required": ["name", "type"]
                }
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.SKELETON;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        AddStakeholderCommand command = binder.bind(getName(), parameters, AddStakeholderCommand.class);
        Stakeholder stakeholder = context.getFactStore().addStakeholder(
                command.name().trim(), command.type(), command.isValidated(), command.notes());
        context.recordMutation("stakeholder " + stakeholder.getId());
        return ToolResult.success("Added stakeholder " + stakeholder.getId() + ": " + stakeholder.getName()
                + " (" + WireNames.of(stakeholder.getType()) + ")");
    }
}
