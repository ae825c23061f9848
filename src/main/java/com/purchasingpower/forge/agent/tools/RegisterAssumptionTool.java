package com.purchasingpower.forge.agent.tools;

import com.purchasingpower.forge.agent.Tool;
import com.purchasingpower.forge.agent.ToolCommandBinder;
import com.purchasingpower.forge.agent.ToolContext;
import com.purchasingpower.forge.agent.ToolResult;
import com.purchasingpower.forge.agent.command.RegisterAssumptionCommand;
import com.purchasingpower.forge.factstore.RegistrationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Adds an assumption to the register. A claim that is already registered (and not
 * invalidated) returns the existing id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RegisterAssumptionTool implements Tool {

    private final ToolCommandBinder binder;

    @Override
    public String getName() {
        return "register_assumption";
    }

    @Override
    public String getDescription() {
        return "Register an assumption the analysis rests on. Call whenever the user states or implies "
                + "something that must be true for the problem or solution to hold. Use depends_on to link "
                + "assumptions that only make sense if another one holds.";
    }

    @Override
    public String getParameterSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "claim": {"type": "string", "description": "The assumption, stated as a falsifiable claim"},
                    "type": {"type": "string", "enum": ["value", "technical", "stakeholder_dependency", "market", "organizational"]},
                    "impact": {"type": "string", "enum": ["high", "medium", "low"], "description": "high: if wrong, changes whether to pursue at all"},
                    "confidence": {"type": "string", "enum": ["validated", "informed", "guessed"]},
                    "basis": {"type": "string", "description": "Why we currently believe this"},
                    "surfaced_by": {"type": "string", "description": "Probe or pattern that surfaced it"},
                    "depends_on": {"type": "array", "items": {"type": "string"}, "description": "Ids of assumptions this one depends on"},
                    "recommended_action": {"type": "string", "description": "How to validate it"},
                    "implied_stakeholders": {"type": "array", "items": {"type": "string"}}
                  },
                  "required": ["claim", "type", "impact", "confidence", "basis", "surfaced_by"]
                }
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.FACT_STORE;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        RegisterAssumptionCommand command = binder.bind(getName(), parameters, RegisterAssumptionCommand.class);
        RegistrationResult result = context.getFactStore()
                .registerAssumption(command.toNewAssumption(), context.getTurnNumber());

        String id = result.assumption().getId();
        if (!result.created()) {
            return ToolResult.success("Assumption already registered as " + id + ": " + result.assumption().getClaim());
        }
        context.recordMutation("registered " + id);
        return ToolResult.success("Registered assumption " + id + ": " + result.assumption().getClaim());
    }
}
