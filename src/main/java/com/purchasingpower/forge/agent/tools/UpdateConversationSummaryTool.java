package com.purchasingpower.forge.agent.tools;

import com.purchasingpower.forge.agent.Tool;
import com.purchasingpower.forge.agent.ToolCommandBinder;
import com.purchasingpower.forge.agent.ToolContext;
import com.purchasingpower.forge.agent.ToolResult;
import com.purchasingpower.forge.agent.command.UpdateConversationSummaryCommand;
import com.purchasingpower.forge.model.routing.RoutingContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Replaces the rolling summary, the router's only memory of earlier turns.
 */
@Component
@RequiredArgsConstructor
public class UpdateConversationSummaryTool implements Tool {

    private final ToolCommandBinder binder;

    @Override
    public String getName() {
        return "update_conversation_summary";
    }

    @Override
    public String getDescription() {
        return "Replace the rolling conversation summary. Call exactly once at the end of every turn with "
                + "3-5 sentences covering where the conversation stands and what is still open.";
    }

    @Override
    public String getParameterSchema() {
        return """
                {
                  "type": "object",
                  "properties": {"summary": {"type": "string"}},
                  "required": ["summary"]
                }
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.ROUTING;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        UpdateConversationSummaryCommand command = binder.bind(getName(), parameters, UpdateConversationSummaryCommand.class);
        RoutingContext routing = context.getState().getRoutingContext();
        routing.setConversationSummary(command.summary().trim());
        routing.setSummaryTurn(context.getTurnNumber());
        context.markSummaryUpdated();
        return ToolResult.success("Conversation summary updated");
    }
}
