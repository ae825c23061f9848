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
public class UpdateTargetAudienceTool implements Tool {

    private final ToolCommandBinder binder;

    @Override
    public String getName() {
        return "update_target_audience";
    }

    @Override
    public String getDescription() {
        return "Record who experiences the problem, as specifically as the user can describe them.";
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
        context.getFactStore().setTargetAudience(command.text().trim());
        context.recordMutation("target audience");
        return ToolResult.success("Target audience updated");
    }
}
