package com.purchasingpower.forge.agent.tools;

import com.purchasingpower.forge.agent.Tool;
import com.purchasingpower.forge.agent.ToolCommandBinder;
import com.purchasingpower.forge.agent.ToolContext;
import com.purchasingpower.forge.agent.ToolResult;
import com.purchasingpower.forge.agent.command.UpdateSuccessMetricsCommand;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class UpdateSuccessMetricsTool implements Tool {

    private final ToolCommandBinder binder;

    @Override
    public String getName() {
        return "update_success_metrics";
    }

    @Override
    public String getDescription() {
        return "Set any of the leading metric, lagging metric and anti-metric. Omitted fields keep their value.";
    }

    @Override
    public String getParameterSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "leading": {"type": "string", "description": "Early signal that the change is working"},
                    "lagging": {"type": "string", "description": "Outcome that proves it worked"},
                    "anti_metric": {"type": "string", "description": "What must not get worse"}
                  }
                }
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.SKELETON;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        UpdateSuccessMetricsCommand command = binder.bind(getName(), parameters, UpdateSuccessMetricsCommand.class);
        if (command.isEmpty()) {
            return ToolResult.failure("Provide at least one of leading, lagging or anti_metric");
        }
        context.getFactStore().updateSuccessMetrics(command.leading(), command.lagging(), command.antiMetric());
        context.recordMutation("success metrics");
        return ToolResult.success("Success metrics updated");
    }
}
