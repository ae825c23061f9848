package com.purchasingpower.forge.agent.tools;

import com.purchasingpower.forge.agent.Tool;
import com.purchasingpower.forge.agent.ToolCommandBinder;
import com.purchasingpower.forge.agent.ToolContext;
import com.purchasingpower.forge.agent.ToolResult;
import com.purchasingpower.forge.agent.command.SetGoNoGoCommand;
import com.purchasingpower.forge.util.WireNames;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class SetGoNoGoTool implements Tool {

    private final ToolCommandBinder binder;

    @Override
    public String getName() {
        return "set_go_no_go";
    }

    @Override
    public String getDescription() {
        return "Record the go/no-go recommendation with the conditions to proceed and the dealbreakers.";
    }

    @Override
    public String getParameterSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "recommendation": {"type": "string", "enum": ["go", "conditional_go", "pivot", "no_go"]},
                    "conditions": {"type": "array", "items": {"type": "string"}},
                    "dealbreakers": {"type": "array", "items": {"type": "string"}}
                  },
                  "required": ["recommendation", "conditions", "dealbreakers"]
                }
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.SKELETON;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        SetGoNoGoCommand command = binder.bind(getName(), parameters, SetGoNoGoCommand.class);
        context.getFactStore().setGoNoGo(command.toGoNoGo());
        context.recordMutation("go/no-go");
        return ToolResult.success("Go/no-go set: " + WireNames.of(command.recommendation()));
    }
}
