package com.purchasingpower.forge.model.skeleton;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The work product being filled in across turns.
 *
 * <p>Fields are either unset or hold the latest confirmed value. There is no bulk setter:
 * every change goes through a named operation on the fact store.
 */
@Data
public class FindingSkeleton {
    private String problemStatement;
    private String targetAudience;
    private Map<String, Stakeholder> stakeholders = new LinkedHashMap<>();
    private int stakeholderCounter;
    private SuccessMetrics successMetrics = new SuccessMetrics();
    private DecisionCriteria decisionCriteria = new DecisionCriteria();
    private SolutionEvaluation solutionEvaluation = new SolutionEvaluation();
}
