package com.purchasingpower.forge.agent.tools;

import com.purchasingpower.forge.agent.Tool;
import com.purchasingpower.forge.agent.ToolCommandBinder;
import com.purchasingpower.forge.agent.ToolContext;
import com.purchasingpower.forge.agent.ToolResult;
import com.purchasingpower.forge.agent.command.TextCommand;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class UpdateProblemStatementTool implements Tool {

    private final ToolCommandBinder binder;

    @Override
    public String getName() {
        return "update_problem_statement";
    }

    @Override
    public String getDescription() {
        return "Replace the problem statement with a sharper version once the user has confirmed it.";
    }

    @Override
    public String getParameterSchema() {
        return """
                {
                  "type": "object",
                  "properties": {"text": {"type": "string"}},
                  "required": ["text"]
                }
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.SKELETON;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        TextCommand command = binder.bind(getName(), parameters, TextCommand.class);
        context.getFactStore().setProblemStatement(command.text().trim());
        context.recordMutation("problem statement");
        return ToolResult.success("Problem statement updated");
    }
}
