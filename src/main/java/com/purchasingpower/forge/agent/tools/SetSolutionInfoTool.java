package com.purchasingpower.forge.agent.tools;

import com.purchasingpower.forge.agent.Tool;
import com.purchasingpower.forge.agent.ToolCommandBinder;
import com.purchasingpower.forge.agent.ToolContext;
import com.purchasingpower.forge.agent.ToolResult;
import com.purchasingpower.forge.agent.command.SetSolutionInfoCommand;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class SetSolutionInfoTool implements Tool {

    private final ToolCommandBinder binder;

    @Override
    public String getName() {
        return "set_solution_info";
    }

    @Override
    public String getDescription() {
        return "Name and describe the solution under evaluation, optionally with a build-vs-buy assessment.";
    }

    @Override
    public String getParameterSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "solution_name": {"type": "string"},
                    "solution_description": {"type": "string"},
                    "build_vs_buy": {"type": "string"}
                  },
                  "required": ["solution_name", "solution_description"]
                }
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.SKELETON;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        SetSolutionInfoCommand command = binder.bind(getName(), parameters, SetSolutionInfoCommand.class);
        context.getFactStore().setSolutionInfo(
                command.solutionName().trim(), command.solutionDescription(), command.buildVsBuy());
        context.recordMutation("solution info");
        return ToolResult.success("Solution info set: " + command.solutionName().trim());
    }
}
