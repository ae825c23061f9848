package com.purchasingpower.forge.artifact;

import java.util.List;

/**
 * Either a rendered document or the list of required fields that are still empty.
 */
public record ArtifactRendering(ArtifactType type, String document, List<String> missingFields) {

    public static ArtifactRendering rendered(ArtifactType type, String document) {
        return new ArtifactRendering(type, document, List.of());
    }

    public static ArtifactRendering incomplete(ArtifactType type, List<String> missingFields) {
        return new ArtifactRendering(type, null, List.copyOf(missingFields));
    }

    public boolean isComplete() {
        return missingFields.isEmpty();
    }

    /**
     * Message for the model naming the fields to populate first.
     */
    public String warning() {
        String tools = type == ArtifactType.PROBLEM_BRIEF
                ? "update_problem_statement, add_stakeholder, update_success_metrics, and add_decision_criteria"
                : "set_solution_info, set_risk_assessment, and set_go_no_go";
        return "WARNING: The following skeleton fields are empty: " + String.join(", ", missingFields) + ". "
                + "You must call " + tools + " BEFORE calling generate_artifact. "
                + "Please populate these fields first, then call generate_artifact again.";
    }
}
