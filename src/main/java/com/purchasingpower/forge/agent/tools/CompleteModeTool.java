package com.purchasingpower.forge.agent.tools;

import com.purchasingpower.forge.agent.Tool;
import com.purchasingpower.forge.agent.ToolCommandBinder;
import com.purchasingpower.forge.agent.ToolContext;
import com.purchasingpower.forge.agent.ToolResult;
import com.purchasingpower.forge.agent.command.CompleteModeCommand;
import com.purchasingpower.forge.model.routing.AnalysisMode;
import com.purchasingpower.forge.routing.ConversationStateMachine;
import com.purchasingpower.forge.util.WireNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Ends the active mode and returns to context gathering. Assumptions, the problem framing and
 * the guidance history survive.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CompleteModeTool implements Tool {

    private final ToolCommandBinder binder;
    private final ConversationStateMachine stateMachine;

    @Override
    public String getName() {
        return "complete_mode";
    }

    @Override
    public String getDescription() {
        return "Call after the mode's artifact has been delivered and the user has no further changes. "
                + "Returns the conversation to context gathering.";
    }

    @Override
    public String getParameterSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "mode_completed": {"type": "string", "enum": ["mode_1", "mode_2"]},
                    "summary": {"type": "string", "description": "What the mode concluded"}
                  },
                  "required": ["mode_completed", "summary"]
                }
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.ROUTING;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        CompleteModeCommand command = binder.bind(getName(), parameters, CompleteModeCommand.class);
        AnalysisMode active = context.getState().getActiveMode();
        if (active == null) {
            return ToolResult.failure("No mode is active; the conversation is already gathering context");
        }

        AnalysisMode named = WireNames.parse(AnalysisMode.class, command.modeCompleted());
        if (named != null && named != active) {
            log.warn("complete_mode named {} but {} is active, completing the active mode", named, active);
        }
        stateMachine.complete(context.getState());
        context.recordMutation("completed " + WireNames.of(active));
        return ToolResult.success("Mode " + WireNames.of(active) + " complete. System returned to context gathering. "
                + "Summary: " + command.summary());
    }
}
