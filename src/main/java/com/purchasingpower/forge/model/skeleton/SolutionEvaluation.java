package com.purchasingpower.forge.model.skeleton;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

/**
 * Working fields of the solution-evaluation mode. Cleared when that mode completes.
 */
@Data
public class SolutionEvaluation {
    private String solutionName;
    private String solutionDescription;
    private String buildVsBuy;

    private RiskAssessment valueRisk;
    private RiskAssessment usabilityRisk;
    private RiskAssessment feasibilityRisk;
    private RiskAssessment viabilityRisk;

    private ValidationPlan validationPlan;
    private GoNoGo goNoGo;

    @JsonIgnore
    public RiskAssessment getRisk(RiskDimension dimension) {
        return switch (dimension) {
            case VALUE -> valueRisk;
            case USABILITY -> usabilityRisk;
            case FEASIBILITY -> feasibilityRisk;
            case VIABILITY -> viabilityRisk;
        };
    }

    public void putRisk(RiskAssessment assessment) {
        switch (assessment.getDimension()) {
            case VALUE -> valueRisk = assessment;
            case USABILITY -> usabilityRisk = assessment;
            case FEASIBILITY -> feasibilityRisk = assessment;
            case VIABILITY -> viabilityRisk = assessment;
        }
    }
}
