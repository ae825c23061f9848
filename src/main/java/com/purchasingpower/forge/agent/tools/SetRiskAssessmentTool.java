package com.purchasingpower.forge.agent.tools;

import com.purchasingpower.forge.agent.Tool;
import com.purchasingpower.forge.agent.ToolCommandBinder;
import com.purchasingpower.forge.agent.ToolContext;
import com.purchasingpower.forge.agent.ToolResult;
import com.purchasingpower.forge.agent.command.SetRiskAssessmentCommand;
import com.purchasingpower.forge.util.WireNames;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class SetRiskAssessmentTool implements Tool {

    private final ToolCommandBinder binder;

    @Override
    public String getName() {
        return "set_risk_assessment";
    }

    @Override
    public String getDescription() {
        return "Assess one of the four product risks (value, usability, feasibility, viability) for the "
                + "solution under evaluation. Replaces any earlier assessment of that dimension.";
    }

    @Override
    public String getParameterSchema() {
        return """
                {
                  "type": "object",
                  "properties": {
                    "dimension": {"type": "string", "enum": ["value", "usability", "feasibility", "viability"]},
                    "level": {"type": "string", "enum": ["low", "medium", "high"]},
                    "summary": {"type": "string"},
                    "evidence_for": {"type": "array", "items": {"type": "string"}, "description": "Evidence the risk is under control"},
                    "evidence_against": {"type": "array", "items": {"type": "string"}, "description": "Concerns"}
                  },
                  "required": ["dimension", "level", "summary"]
                }
                """;
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.SKELETON;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        SetRiskAssessmentCommand command = binder.bind(getName(), parameters, SetRiskAssessmentCommand.class);
        context.getFactStore().setRiskAssessment(command.toAssessment());

        String dimension = WireNames.of(command.dimension());
        context.recordMutation(dimension + " risk");
        return ToolResult.success("Set " + dimension + " risk to " + WireNames.of(command.level()) + ": " + command.summary());
    }
}
